package org.scharp.csv2netcdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts every file named in a {@link ConverterConfig}, one after the other, in the configured order.
 * <p>
 * Each file yields its own NetCDF file.  Nothing is shared between files, so a failure in one never changes the
 * output of another.  What happens after a failure is decided by the configured {@link FailurePolicy}.
 * </p>
 */
public final class ConversionBatch {
    private static final Logger logger = LoggerFactory.getLogger(ConversionBatch.class);

    /**
     * The outcome of a batch.
     */
    public static final class BatchResult {
        private final List<Path> artifacts;
        private final List<ConversionException> failures;

        BatchResult(List<Path> artifacts, List<ConversionException> failures) {
            this.artifacts = Collections.unmodifiableList(new ArrayList<>(artifacts));
            this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        }

        /**
         * Gets the NetCDF files that were written.
         *
         * @return An unmodifiable list of paths, in the order in which they were written.
         */
        public List<Path> artifacts() {
            return artifacts;
        }

        /**
         * Gets the reasons why files couldn't be converted.
         *
         * @return An unmodifiable list of exceptions, each naming the file that caused it.  This is always empty when
         *     the failure policy is {@link FailurePolicy#ABORT}.
         */
        public List<ConversionException> failures() {
            return failures;
        }

        /**
         * Determines whether every file was converted.
         *
         * @return {@code true}, if there were no failures.
         */
        public boolean isSuccessful() {
            return failures.isEmpty();
        }
    }

    private final ConverterConfig config;
    private final CsvToNetcdfConverter converter;

    /**
     * Creates a batch.
     *
     * @param config
     *     What to convert, and how.
     * @param writer
     *     Where the finished datasets go.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     */
    public ConversionBatch(ConverterConfig config, DatasetWriter writer) {
        ArgumentUtil.checkNotNull(config, "config");
        ArgumentUtil.checkNotNull(writer, "writer");

        this.config = config;
        this.converter = new CsvToNetcdfConverter(config, writer);
    }

    /**
     * Converts the configured files.
     *
     * @param provenance
     *     Who is running the batch, when, and with what.  Every file gets the same provenance.
     *
     * @return Which files were written and, if the failure policy is {@link FailurePolicy#CONTINUE}, which files
     *     failed.
     *
     * @throws NullPointerException
     *     if {@code provenance} is {@code null}.
     * @throws ConversionException
     *     if the failure policy is {@link FailurePolicy#ABORT} and a file couldn't be converted.  The files after it
     *     are not attempted.
     */
    public BatchResult run(Provenance provenance) throws ConversionException {
        ArgumentUtil.checkNotNull(provenance, "provenance");

        List<Path> artifacts = new ArrayList<>();
        List<ConversionException> failures = new ArrayList<>();
        for (Path source : config.inputPaths()) {
            try {
                artifacts.add(converter.convert(source, config.outputDirectory(), provenance));
            } catch (ConversionException e) {
                if (config.failurePolicy() == FailurePolicy.ABORT) {
                    throw e;
                }
                logger.warn("Skipping {}: {}", source, e.getMessage());
                failures.add(e);
            }
        }

        if (!failures.isEmpty()) {
            logger.warn("{} of {} files could not be converted", failures.size(), config.inputPaths().size());
        }
        return new BatchResult(artifacts, failures);
    }
}
