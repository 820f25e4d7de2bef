///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts one weather station CSV file into one NetCDF file.
 * <p>
 * Sample usage:
 * </p>
 * <pre>
 * CsvToNetcdfConverter converter = new CsvToNetcdfConverter(
 *     MetadataProfile.CF,
 *     NumericPolicy.MIXED,
 *     Map.of("institution", "Marine Observatory", "license", "CC-BY-4.0"),
 *     new NetcdfDatasetWriter());
 *
 * Path netcdfFile = converter.convert(
 *     Path.of("data/station-1.csv"),
 *     Path.of("out"),
 *     Provenance.current(CsvToNetcdfConverter.CONVERTER_NAME));
 *
 * // netcdfFile is out/station-1.nc
 * </pre>
 * <p>
 * A conversion reads the whole file, builds a dataset whose coordinate is the timestamp column, attaches units (and,
 * depending on the {@link MetadataProfile}, standard names), computes the geographic and temporal coverage, records
 * provenance, adds the configured global attributes, and hands the result to a {@link DatasetWriter}.  If the input
 * can't be read, nothing is written.
 * </p>
 * <p>
 * Files are independent.  A converter holds no state between calls to {@link #convert}, so it can be reused for
 * any number of files.
 * </p>
 */
public final class CsvToNetcdfConverter {
    private static final Logger logger = LoggerFactory.getLogger(CsvToNetcdfConverter.class);

    /** The name under which this program records itself in a file's history. */
    public static final String CONVERTER_NAME = "csv2netcdf";

    private final RecordParser recordParser;
    private final DatasetBuilder datasetBuilder;
    private final AttributeAnnotator attributeAnnotator;
    private final ExtentComputer extentComputer;
    private final ProvenanceRecorder provenanceRecorder;
    private final ConfiguredAttributeMerger attributeMerger;
    private final DatasetWriter writer;

    /**
     * Creates a converter.
     *
     * @param metadataProfile
     *     Which metadata to attach.
     * @param numericPolicy
     *     How the observed quantities are typed.
     * @param globalAttributes
     *     Attributes to add to every dataset.  The map is copied.
     * @param writer
     *     Where the finished datasets go.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws IllegalArgumentException
     *     if a global attribute has a blank name or a value that is not a string, number, or boolean.
     */
    public CsvToNetcdfConverter(MetadataProfile metadataProfile, NumericPolicy numericPolicy,
        Map<String, ?> globalAttributes, DatasetWriter writer) {
        ArgumentUtil.checkNotNull(metadataProfile, "metadataProfile");
        ArgumentUtil.checkNotNull(numericPolicy, "numericPolicy");
        ArgumentUtil.checkNotNull(globalAttributes, "globalAttributes");
        ArgumentUtil.checkNotNull(writer, "writer");

        SchemaDefinition schema = SchemaDefinition.stationTelemetry(numericPolicy);
        this.recordParser = new RecordParser(schema);
        this.datasetBuilder = new DatasetBuilder(schema);
        this.attributeAnnotator = new AttributeAnnotator(metadataProfile);
        this.extentComputer = new ExtentComputer();
        this.provenanceRecorder = new ProvenanceRecorder(metadataProfile);
        Map<String, Object> attributes = new LinkedHashMap<>(globalAttributes);
        this.attributeMerger = new ConfiguredAttributeMerger(Collections.unmodifiableMap(attributes));
        this.writer = writer;
    }

    /**
     * Creates a converter with the settings from a configuration.
     *
     * @param config
     *     The configuration.
     * @param writer
     *     Where the finished datasets go.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     */
    public CsvToNetcdfConverter(ConverterConfig config, DatasetWriter writer) {
        this(profileOf(config), config.numericPolicy(), config.globalAttributes(), writer);
    }

    private static MetadataProfile profileOf(ConverterConfig config) {
        ArgumentUtil.checkNotNull(config, "config");
        return config.metadataProfile();
    }

    /**
     * Converts a CSV file into a NetCDF file.
     *
     * @param source
     *     The CSV file to read.
     * @param outputDirectory
     *     The directory in which to write the NetCDF file.  It must exist.  The file is named after {@code source}
     *     with a {@code .nc} extension.  An existing file with that name is replaced.
     * @param provenance
     *     Who is converting the file, when, and with what.
     *
     * @return The path of the NetCDF file that was written.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws RecordFormatException
     *     if {@code source} can't be read or doesn't match the station telemetry layout.  Nothing is written.
     * @throws PersistenceException
     *     if the NetCDF file couldn't be written.
     */
    public Path convert(Path source, Path outputDirectory, Provenance provenance)
        throws RecordFormatException, PersistenceException {
        ArgumentUtil.checkNotNull(source, "source");
        ArgumentUtil.checkNotNull(outputDirectory, "outputDirectory");
        ArgumentUtil.checkNotNull(provenance, "provenance");

        Path target = FileNames.netcdfFileFor(source, outputDirectory);
        logger.info("Converting {} to {}", source, target);

        Dataset dataset = toDataset(source, target, provenance);
        writer.write(dataset, target);

        logger.debug("Wrote {} time steps and {} data variables to {}",
            dataset.length(), dataset.dataVariables().size(), target);
        return target;
    }

    /**
     * Reads and annotates a dataset without writing it.
     *
     * @param source
     *     The CSV file to read.
     * @param target
     *     The file the dataset will be written to.  It is only recorded in the history.
     * @param provenance
     *     Who is converting the file, when, and with what.
     *
     * @return The annotated dataset.
     *
     * @throws RecordFormatException
     *     if {@code source} can't be read or doesn't match the station telemetry layout.
     */
    Dataset toDataset(Path source, Path target, Provenance provenance) throws RecordFormatException {
        ColumnTable table = recordParser.parse(source);
        Dataset dataset = datasetBuilder.build(table);

        attributeAnnotator.annotate(dataset, source);
        extentComputer.computeExtents(dataset);
        provenanceRecorder.record(dataset, provenance, source, target);
        attributeMerger.merge(dataset);
        return dataset;
    }
}
