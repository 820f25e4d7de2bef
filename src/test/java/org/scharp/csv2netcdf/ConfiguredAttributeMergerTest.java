package org.scharp.csv2netcdf;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ConfiguredAttributeMerger}. */
public class ConfiguredAttributeMergerTest {

    @Test
    void mergeOverridesComputedAttributes() {
        Dataset dataset = SampleDatasets.singleStep(NumericPolicy.ALL_FLOAT);
        dataset.setAttribute("title", "station");
        dataset.setAttribute("geospatial_lat_min", 34.5);

        Map<String, Object> globalAttributes = new LinkedHashMap<>();
        globalAttributes.put("institution", "Marine Observatory");
        globalAttributes.put("title", "Pier 7 weather station");
        globalAttributes.put("station_id", 7);
        globalAttributes.put("elevation", 4.5);
        globalAttributes.put("quality_controlled", true);
        new ConfiguredAttributeMerger(globalAttributes).merge(dataset);

        assertEquals("Pier 7 weather station", dataset.attribute("title"));
        assertEquals(34.5, dataset.attribute("geospatial_lat_min"));
        assertEquals("Marine Observatory", dataset.attribute("institution"));
        assertEquals(7, dataset.attribute("station_id"));
        assertEquals(4.5, dataset.attribute("elevation"));
        assertEquals("true", dataset.attribute("quality_controlled"));

        // A replaced attribute keeps its position.
        assertEquals(
            List.of("title", "geospatial_lat_min", "institution", "station_id", "elevation", "quality_controlled"),
            List.copyOf(dataset.attributes().keySet()));
    }

    @Test
    void emptyValuesAreSkipped() {
        Dataset dataset = SampleDatasets.singleStep(NumericPolicy.ALL_FLOAT);
        dataset.setAttribute("title", "station");

        Map<String, Object> globalAttributes = new LinkedHashMap<>();
        globalAttributes.put("title", ""); // doesn't remove the computed title
        globalAttributes.put("comment", null);
        globalAttributes.put("summary", "   ");
        globalAttributes.put("quality_controlled", false);
        globalAttributes.put("station_id", 0);
        globalAttributes.put("offset", 0.0);
        globalAttributes.put("keywords", List.of());
        globalAttributes.put("contributors", Map.of());
        new ConfiguredAttributeMerger(globalAttributes).merge(dataset);

        assertEquals(Map.of("title", "station"), dataset.attributes());
    }

    @Test
    void nestedValuesAreRejected() {
        Map<String, Object> globalAttributes = Map.of("keywords", List.of("wind", "pressure"));

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ConfiguredAttributeMerger(globalAttributes));
        assertEquals("global attribute \"keywords\" must be a string, number, or boolean", exception.getMessage());
    }

    @Test
    void blankNamesAreRejected() {
        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ConfiguredAttributeMerger(Map.of(" ", "value")));
        assertEquals("global attribute names must not be blank", exception.getMessage());
    }

    @Test
    void noAttributes() {
        Dataset dataset = SampleDatasets.singleStep(NumericPolicy.ALL_FLOAT);
        new ConfiguredAttributeMerger(Map.of()).merge(dataset);
        assertTrue(dataset.attributes().isEmpty());
        assertNull(dataset.attribute("title"));
    }

    /** Tests for {@link ConfiguredAttributeMerger#isEmpty(Object)} */
    @Test
    void testIsEmpty() {
        assertTrue(ConfiguredAttributeMerger.isEmpty(null));
        assertTrue(ConfiguredAttributeMerger.isEmpty(""));
        assertTrue(ConfiguredAttributeMerger.isEmpty("\t"));
        assertTrue(ConfiguredAttributeMerger.isEmpty(Boolean.FALSE));
        assertTrue(ConfiguredAttributeMerger.isEmpty(0));
        assertTrue(ConfiguredAttributeMerger.isEmpty(-0.0));
        assertTrue(ConfiguredAttributeMerger.isEmpty(0L));
        assertTrue(ConfiguredAttributeMerger.isEmpty(List.of()));
        assertTrue(ConfiguredAttributeMerger.isEmpty(Map.of()));

        assertFalse(ConfiguredAttributeMerger.isEmpty("x"));
        assertFalse(ConfiguredAttributeMerger.isEmpty(Boolean.TRUE));
        assertFalse(ConfiguredAttributeMerger.isEmpty(-1));
        assertFalse(ConfiguredAttributeMerger.isEmpty(Double.NaN));
        assertFalse(ConfiguredAttributeMerger.isEmpty(List.of(1)));
    }
}
