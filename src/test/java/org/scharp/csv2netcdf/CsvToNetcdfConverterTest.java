package org.scharp.csv2netcdf;

import org.junit.jupiter.api.Test;
import ucar.ma2.DataType;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFile;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link CsvToNetcdfConverter}. */
public class CsvToNetcdfConverterTest {

    private static final Provenance PROVENANCE =
        new Provenance(Instant.parse("2024-05-01T12:00:00Z"), "alice", CsvToNetcdfConverter.CONVERTER_NAME);

    private static CsvToNetcdfConverter converter(MetadataProfile profile, NumericPolicy policy) {
        return new CsvToNetcdfConverter(profile, policy, Map.of(), new NetcdfDatasetWriter());
    }

    /** Reads every global attribute of a NetCDF file as a string. */
    private static Map<String, String> globalAttributes(Path netcdfPath) throws Exception {
        Map<String, String> attributes = new LinkedHashMap<>();
        NetcdfFile netcdfFile = NetcdfFile.open(netcdfPath.toString());
        try {
            for (Attribute attribute : netcdfFile.getGlobalAttributes()) {
                attributes.put(
                    attribute.getName(),
                    attribute.isString() ? attribute.getStringValue() : attribute.getNumericValue().toString());
            }
        } finally {
            netcdfFile.close();
        }
        return attributes;
    }

    @Test
    void convertSingleRow() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-convertSingleRow");
        try {
            Path source = StationFiles.write(directory, "station.csv", List.of(StationFiles.SAMPLE_ROW));
            Path target = converter(MetadataProfile.UNITS_ONLY, NumericPolicy.ALL_FLOAT).
                convert(source, directory, PROVENANCE);
            assertEquals(directory.resolve("station.nc"), target);

            NetcdfFile netcdfFile = NetcdfFile.open(target.toString());
            try {
                ucar.nc2.Variable time = netcdfFile.findVariable("time");
                assertEquals(1, time.getShape()[0]);
                assertEquals(1700000000.0, time.read().getDouble(0));

                ucar.nc2.Variable latitude = netcdfFile.findVariable("latitude");
                assertEquals(34.5, latitude.read().getDouble(0));
                assertEquals("decimal_degrees", latitude.findAttribute("units").getStringValue());
                assertNull(latitude.findAttribute("standard_name"));

                // Every variable has a unit.
                for (ucar.nc2.Variable variable : netcdfFile.getVariables()) {
                    Attribute units = variable.findAttribute("units");
                    assertFalse(units.getStringValue().isBlank(), variable.getShortName());
                }

                assertEquals(34.5,
                    netcdfFile.findGlobalAttribute("geospatial_lat_min").getNumericValue().doubleValue());
                assertEquals(34.5,
                    netcdfFile.findGlobalAttribute("geospatial_lat_max").getNumericValue().doubleValue());
                assertEquals(-120.2,
                    netcdfFile.findGlobalAttribute("geospatial_lon_min").getNumericValue().doubleValue());
                assertEquals(1700000000.0,
                    netcdfFile.findGlobalAttribute("time_coverage_end").getNumericValue().doubleValue());
                assertEquals("timeSeries", netcdfFile.findGlobalAttribute("featureType").getStringValue());
                assertEquals("station", netcdfFile.findGlobalAttribute("title").getStringValue());
                assertEquals("2024-05-01", netcdfFile.findGlobalAttribute("date_created").getStringValue());
                assertNull(netcdfFile.findGlobalAttribute("history"));
            } finally {
                netcdfFile.close();
            }
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void convertMixedTypes() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-convertMixedTypes");
        try {
            Path source = StationFiles.write(directory, "station.csv", List.of(StationFiles.SAMPLE_ROW));
            Path target = converter(MetadataProfile.UNITS_ONLY, NumericPolicy.MIXED).
                convert(source, directory, PROVENANCE);

            NetcdfFile netcdfFile = NetcdfFile.open(target.toString());
            try {
                ucar.nc2.Variable direction = netcdfFile.findVariable("true_wind_direction");
                assertEquals(DataType.INT, direction.getDataType());
                assertEquals(180, direction.read().getInt(0));

                ucar.nc2.Variable humidity = netcdfFile.findVariable("air_humidity");
                assertEquals(DataType.INT, humidity.getDataType());
                assertEquals(60, humidity.read().getInt(0));

                for (String name : List.of("latitude", "longitude", "true_wind_speed", "air_temperature",
                    "dew_point", "immediate_air_pressure", "average_air_pressure_for_last_minute",
                    "sea_level_air_pressure")) {
                    assertEquals(DataType.DOUBLE, netcdfFile.findVariable(name).getDataType(), name);
                }
            } finally {
                netcdfFile.close();
            }
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void convertCf() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-convertCf");
        try {
            Path source = StationFiles.write(directory, "station.csv", StationFiles.THREE_ROWS);
            Path target = converter(MetadataProfile.CF, NumericPolicy.ALL_FLOAT).
                convert(source, directory, PROVENANCE);

            NetcdfFile netcdfFile = NetcdfFile.open(target.toString());
            try {
                for (ucar.nc2.Variable variable : netcdfFile.getVariables()) {
                    assertEquals(3, variable.getShape()[0], variable.getShortName());
                    assertFalse(variable.findAttribute("units").getStringValue().isBlank());
                    assertFalse(variable.findAttribute("standard_name").getStringValue().isBlank());
                    assertEquals(variable.getShortName(), variable.findAttribute("long_name").getStringValue());
                }
                assertEquals("m s-1",
                    netcdfFile.findVariable("true_wind_speed").findAttribute("units").getStringValue());

                assertNull(netcdfFile.findGlobalAttribute("featureType"));
                assertEquals(
                    "2024-05-01T12:00:00Z alice csv2netcdf: " + source + " -> " + target,
                    netcdfFile.findGlobalAttribute("history").getStringValue());

                double latitudeMinimum =
                    netcdfFile.findGlobalAttribute("geospatial_lat_min").getNumericValue().doubleValue();
                double latitudeMaximum =
                    netcdfFile.findGlobalAttribute("geospatial_lat_max").getNumericValue().doubleValue();
                assertEquals(34.4, latitudeMinimum);
                assertEquals(34.6, latitudeMaximum);
                double start = netcdfFile.findGlobalAttribute("time_coverage_start").getNumericValue().doubleValue();
                double end = netcdfFile.findGlobalAttribute("time_coverage_end").getNumericValue().doubleValue();
                assertThat(start, lessThanOrEqualTo(end));
                assertEquals(1700000120.0, end);
            } finally {
                netcdfFile.close();
            }
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void missingPositionsDontFailTheConversion() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-missingPositions");
        try {
            Path source = StationFiles.write(directory, "station.csv", List.of(
                "1700000000,,,5.1,180,18.2,60,12.0,1013.2,0.1,1014.0",
                "1700000060,,,5.4,185,18.4,61,12.1,1013.1,-0.1,1013.9"));
            Path target = converter(MetadataProfile.UNITS_ONLY, NumericPolicy.ALL_FLOAT).
                convert(source, directory, PROVENANCE);

            NetcdfFile netcdfFile = NetcdfFile.open(target.toString());
            try {
                assertTrue(Double.isNaN(
                    netcdfFile.findGlobalAttribute("geospatial_lat_min").getNumericValue().doubleValue()));
                assertTrue(Double.isNaN(
                    netcdfFile.findGlobalAttribute("geospatial_lon_max").getNumericValue().doubleValue()));
                assertEquals(1700000060.0,
                    netcdfFile.findGlobalAttribute("time_coverage_end").getNumericValue().doubleValue());
            } finally {
                netcdfFile.close();
            }
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void tenColumnFileWritesNothing() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-tenColumnFile");
        Path outputDirectory = directory.resolve("out");
        try {
            Files.createDirectory(outputDirectory);
            Path source = StationFiles.write(directory, "short.csv", List.of(
                "1700000000,34.5,-120.2,5.1,180,18.2,60,12.0,1013.2,0.1"));

            List<Dataset> written = new ArrayList<>();
            CsvToNetcdfConverter converter = new CsvToNetcdfConverter(
                MetadataProfile.UNITS_ONLY,
                NumericPolicy.ALL_FLOAT,
                Map.of(),
                (dataset, target) -> written.add(dataset));

            RecordFormatException exception = assertThrows(
                RecordFormatException.class,
                () -> converter.convert(source, outputDirectory, PROVENANCE));
            assertEquals(source, exception.file());
            assertTrue(exception.getMessage().startsWith(source.toString()), exception.getMessage());

            assertTrue(written.isEmpty());
            assertFalse(Files.exists(outputDirectory.resolve("short.nc")));

            // Same with the real writer.
            assertThrows(
                RecordFormatException.class,
                () -> converter(MetadataProfile.CF, NumericPolicy.MIXED).convert(source, outputDirectory, PROVENANCE));
            try (var files = Files.list(outputDirectory)) {
                assertEquals(0, files.count());
            }
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(outputDirectory);
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void rerunDiffersOnlyInProvenance() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-rerun");
        Path firstDirectory = directory.resolve("first");
        Path secondDirectory = directory.resolve("second");
        try {
            Files.createDirectory(firstDirectory);
            Files.createDirectory(secondDirectory);
            Path source = StationFiles.write(directory, "station.csv", StationFiles.THREE_ROWS);
            CsvToNetcdfConverter converter = new CsvToNetcdfConverter(
                MetadataProfile.CF,
                NumericPolicy.MIXED,
                Map.of("institution", "Marine Observatory"),
                new NetcdfDatasetWriter());

            Path first = converter.convert(source, firstDirectory, PROVENANCE);
            Provenance later = new Provenance(Instant.parse("2024-05-02T08:00:00Z"), "bob", "csv2netcdf");
            Path second = converter.convert(source, secondDirectory, later);

            Map<String, String> firstAttributes = globalAttributes(first);
            Map<String, String> secondAttributes = globalAttributes(second);
            assertNotEquals(firstAttributes.remove("date_created"), secondAttributes.remove("date_created"));
            assertNotEquals(firstAttributes.remove("history"), secondAttributes.remove("history"));
            assertEquals(firstAttributes, secondAttributes);
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(firstDirectory);
            StationFiles.deleteDirectory(secondDirectory);
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void globalAttributesOverrideComputedOnes() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-globalAttributes");
        try {
            Path source = StationFiles.write(directory, "station.csv", List.of(StationFiles.SAMPLE_ROW));

            Map<String, Object> globalAttributes = new LinkedHashMap<>();
            globalAttributes.put("title", "Pier 7");
            globalAttributes.put("featureType", "");
            globalAttributes.put("license", null);
            globalAttributes.put("station_id", 7);
            CsvToNetcdfConverter converter = new CsvToNetcdfConverter(
                MetadataProfile.UNITS_ONLY,
                NumericPolicy.ALL_FLOAT,
                globalAttributes,
                new NetcdfDatasetWriter());
            globalAttributes.put("title", "changed after construction");

            Dataset dataset = converter.toDataset(source, directory.resolve("station.nc"), PROVENANCE);
            assertEquals("Pier 7", dataset.attribute("title"));
            assertEquals("timeSeries", dataset.attribute("featureType"));
            assertEquals(7, dataset.attribute("station_id"));
            assertFalse(dataset.attributes().containsKey("license"));
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void convertWithConfiguration() throws Exception {
        Path directory = Files.createTempDirectory("csv2netcdf-convertWithConfiguration");
        try {
            Path source = StationFiles.write(directory, "station.csv", List.of(StationFiles.SAMPLE_ROW));
            ConverterConfig config = ConverterConfig.builder().
                inputPaths(List.of(source)).
                outputDirectory(directory).
                metadataProfile(MetadataProfile.CF).
                numericPolicy(NumericPolicy.MIXED).
                globalAttributes(Map.of("institution", "Marine Observatory")).
                build();

            Dataset dataset = new CsvToNetcdfConverter(config, new NetcdfDatasetWriter()).
                toDataset(source, directory.resolve("station.nc"), PROVENANCE);
            assertEquals(StorageType.INT32, dataset.variable("air_humidity").storageType());
            assertEquals("humidity_mixing_ratio", dataset.variable("air_humidity").attribute("standard_name"));
            assertEquals("Marine Observatory", dataset.attribute("institution"));
        } finally {
            // Always clean up
            StationFiles.deleteDirectory(directory);
        }
    }

    @Test
    void constructWithNullArguments() {
        Exception exception = assertThrows(
            NullPointerException.class,
            () -> new CsvToNetcdfConverter(null, NumericPolicy.MIXED, Map.of(), new NetcdfDatasetWriter()));
        assertEquals("metadataProfile must not be null", exception.getMessage());

        exception = assertThrows(
            NullPointerException.class,
            () -> new CsvToNetcdfConverter(MetadataProfile.CF, NumericPolicy.MIXED, Map.of(), null));
        assertEquals("writer must not be null", exception.getMessage());

        exception = assertThrows(
            NullPointerException.class,
            () -> new CsvToNetcdfConverter(null, new NetcdfDatasetWriter()));
        assertEquals("config must not be null", exception.getMessage());
    }
}
