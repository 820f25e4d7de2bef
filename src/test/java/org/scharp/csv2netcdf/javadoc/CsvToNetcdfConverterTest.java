package org.scharp.csv2netcdf.javadoc;

import org.junit.jupiter.api.Test;
import org.scharp.csv2netcdf.ConversionBatch;
import org.scharp.csv2netcdf.ConversionException;
import org.scharp.csv2netcdf.ConverterConfig;
import org.scharp.csv2netcdf.CsvToNetcdfConverter;
import org.scharp.csv2netcdf.MetadataProfile;
import org.scharp.csv2netcdf.NetcdfDatasetWriter;
import org.scharp.csv2netcdf.NumericPolicy;
import org.scharp.csv2netcdf.Provenance;
import ucar.ma2.DataType;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A class for executing the sample code that's within the JavaDoc.
 */
public class CsvToNetcdfConverterTest {

    private static Path convertFile(Path source, Path outputDirectory) throws ConversionException {

        CsvToNetcdfConverter converter = new CsvToNetcdfConverter(
            MetadataProfile.CF,
            NumericPolicy.MIXED,
            Map.of("institution", "Marine Observatory", "license", "CC-BY-4.0"),
            new NetcdfDatasetWriter());

        Path netcdfFile = converter.convert(
            source,
            outputDirectory,
            Provenance.current(CsvToNetcdfConverter.CONVERTER_NAME));

        return netcdfFile;
    }

    private static ConversionBatch.BatchResult convertBatch(Path first, Path second, Path outputDirectory)
        throws ConversionException {

        ConverterConfig config = ConverterConfig.builder().
            inputPaths(List.of(first, second)).
            outputDirectory(outputDirectory).
            globalAttributes(Map.of("institution", "Marine Observatory")).
            metadataProfile(MetadataProfile.CF).
            build();

        return new ConversionBatch(config, new NetcdfDatasetWriter()).
            run(Provenance.current(CsvToNetcdfConverter.CONVERTER_NAME));
    }

    private static Path writeStationFile(Path directory, String fileName) throws IOException {
        return Files.write(
            directory.resolve(fileName),
            List.of(
                "1700000000,34.5,-120.2,5.1,180,18.2,60,12.0,1013.2,0.1,1014.0",
                "1700000060,34.6,-120.1,5.4,185,18.4,61,12.1,1013.1,-0.1,1013.9"));
    }

    @Test
    public void runSampleCode() throws Exception {

        Path directory = Files.createTempDirectory("csv2netcdf-sample");
        Path source = writeStationFile(directory, "station-1.csv");
        Path netcdfPath = directory.resolve("station-1.nc");
        try {
            // Execute the sample code to convert a file.
            assertEquals(netcdfPath, convertFile(source, directory));

            // Read the NetCDF file with netcdf-java to confirm that it was written correctly.
            NetcdfFile netcdfFile = NetcdfFile.open(netcdfPath.toString());
            try {
                assertEquals(2, netcdfFile.findDimension("time").getLength());
                assertEquals(11, netcdfFile.getVariables().size());

                Variable direction = netcdfFile.findVariable("true_wind_direction");
                assertEquals(DataType.INT, direction.getDataType());
                assertEquals(185, direction.read().getInt(1));
                assertEquals("wind_from_direction", direction.findAttribute("standard_name").getStringValue());

                assertEquals("station-1", netcdfFile.findGlobalAttribute("title").getStringValue());
                assertEquals("Marine Observatory", netcdfFile.findGlobalAttribute("institution").getStringValue());
                assertEquals("CC-BY-4.0", netcdfFile.findGlobalAttribute("license").getStringValue());
                assertTrue(netcdfFile.findGlobalAttribute("history").getStringValue().contains(" csv2netcdf: "));
            } finally {
                netcdfFile.close();
            }
        } finally {
            // Always clean up
            Files.deleteIfExists(netcdfPath);
            Files.deleteIfExists(source);
            Files.deleteIfExists(directory);
        }
    }

    @Test
    public void runConfigurationSampleCode() throws Exception {

        Path directory = Files.createTempDirectory("csv2netcdf-config-sample");
        Path first = writeStationFile(directory, "station-1.csv");
        Path second = writeStationFile(directory, "station-2.csv");
        try {
            ConversionBatch.BatchResult result = convertBatch(first, second, directory);

            assertTrue(result.isSuccessful());
            assertEquals(List.of(directory.resolve("station-1.nc"), directory.resolve("station-2.nc")),
                result.artifacts());
        } finally {
            // Always clean up
            Files.deleteIfExists(directory.resolve("station-1.nc"));
            Files.deleteIfExists(directory.resolve("station-2.nc"));
            Files.deleteIfExists(first);
            Files.deleteIfExists(second);
            Files.deleteIfExists(directory);
        }
    }
}
