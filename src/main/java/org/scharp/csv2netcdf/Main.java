///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The command-line entry point.
 * <p>
 * Usage: {@code java -jar csv2netcdf.jar [config.yaml]}.  Without an argument, {@code config.yaml} in the working
 * directory is read.  The process exits with status 0 if every file was converted and 1 otherwise.
 * </p>
 */
public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_CONFIG_FILE = "config.yaml";

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private Main() {
    }

    /**
     * Converts the files named in a configuration file.
     *
     * @param args
     *     The command-line arguments.  The first, if present, is the path of the configuration file.
     */
    public static void main(String[] args) {
        Path configFile = Path.of(args.length == 0 ? DEFAULT_CONFIG_FILE : args[0]);
        System.exit(run(configFile, Provenance.current(CsvToNetcdfConverter.CONVERTER_NAME)));
    }

    /**
     * Converts the files named in a configuration file.
     *
     * @param configFile
     *     The YAML configuration file.
     * @param provenance
     *     Who is running the conversion, when, and with what.
     *
     * @return The process exit status.
     */
    static int run(Path configFile, Provenance provenance) {
        try {
            ConverterConfig config = new ConfigLoader().load(configFile);

            Path outputDirectory = config.outputDirectory();
            try {
                Files.createDirectories(outputDirectory);
            } catch (IOException e) {
                logger.error("Could not create output directory {}", outputDirectory, e);
                return EXIT_FAILURE;
            }

            ConversionBatch.BatchResult result = new ConversionBatch(config, new NetcdfDatasetWriter()).run(provenance);
            for (Path artifact : result.artifacts()) {
                logger.info("NetCDF file '{}' created successfully", artifact);
            }
            for (ConversionException failure : result.failures()) {
                logger.error("Could not convert {}", failure.file(), failure);
            }
            return result.isSuccessful() ? EXIT_SUCCESS : EXIT_FAILURE;

        } catch (ConversionException e) {
            logger.error("Conversion failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
