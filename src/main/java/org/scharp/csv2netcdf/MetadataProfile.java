///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.util.Locale;
import java.util.Map;

/**
 * Which metadata is attached to a dataset and which vocabulary it is taken from.
 * <p>
 * Each profile has exactly one unit convention, so a dataset never mixes conventions.
 * </p>
 */
public enum MetadataProfile {

    /**
     * Only a {@code units} attribute on each variable, using the station's own unit names (like
     * {@code decimal_degrees}).  The dataset is tagged with {@code featureType=timeSeries}.
     */
    UNITS_ONLY(
        Map.ofEntries(
            Map.entry("time", "seconds since 1970-01-01 00:00:00"),
            Map.entry("latitude", "decimal_degrees"),
            Map.entry("longitude", "decimal_degrees"),
            Map.entry("true_wind_speed", "m/s"),
            Map.entry("true_wind_direction", "degrees"),
            Map.entry("air_temperature", "degrees_celsius"),
            Map.entry("air_humidity", "percent"),
            Map.entry("dew_point", "degrees_celsius"),
            Map.entry("immediate_air_pressure", "hPa"),
            Map.entry("average_air_pressure_for_last_minute", "hPa"),
            Map.entry("sea_level_air_pressure", "hPa")),
        Map.of()),

    /**
     * CF metadata: UDUNITS unit strings, a {@code standard_name} and a {@code long_name} on each variable, and a
     * {@code history} attribute on the dataset.
     */
    CF(
        Map.ofEntries(
            Map.entry("time", "seconds since 1970-01-01 00:00:00"),
            Map.entry("latitude", "degree_north"),
            Map.entry("longitude", "degree_east"),
            Map.entry("true_wind_speed", "m s-1"),
            Map.entry("true_wind_direction", "degrees"),
            Map.entry("air_temperature", "degree_Celsius"),
            Map.entry("air_humidity", "percent"),
            Map.entry("dew_point", "degree_Celsius"),
            Map.entry("immediate_air_pressure", "hPa"),
            Map.entry("average_air_pressure_for_last_minute", "hPa s-1"),
            Map.entry("sea_level_air_pressure", "hPa")),
        Map.ofEntries(
            Map.entry("time", "time"),
            Map.entry("latitude", "latitude"),
            Map.entry("longitude", "longitude"),
            Map.entry("true_wind_speed", "wind_speed"),
            Map.entry("true_wind_direction", "wind_from_direction"),
            Map.entry("air_temperature", "air_temperature"),
            Map.entry("air_humidity", "humidity_mixing_ratio"),
            Map.entry("dew_point", "dew_point_temperature"),
            Map.entry("immediate_air_pressure", "air_pressure"),
            Map.entry("average_air_pressure_for_last_minute", "tendency_of_air_pressure"),
            Map.entry("sea_level_air_pressure", "air_pressure_at_mean_sea_level")));

    private final Map<String, String> units;
    private final Map<String, String> standardNames;

    MetadataProfile(Map<String, String> units, Map<String, String> standardNames) {
        this.units = units;
        this.standardNames = standardNames;
    }

    /**
     * Gets the unit string of a variable.
     *
     * @param variableName
     *     The variable's name.
     *
     * @return The unit string. This is never {@code null}.
     *
     * @throws VocabularyLookupException
     *     if this profile has no unit for {@code variableName}.
     */
    public String unitsOf(String variableName) {
        String unit = units.get(variableName);
        if (unit == null) {
            throw new VocabularyLookupException(this + " has no units for variable \"" + variableName + "\"");
        }
        return unit;
    }

    /**
     * Gets the CF standard name of a variable.
     *
     * @param variableName
     *     The variable's name.
     *
     * @return The standard name. This is never {@code null}.
     *
     * @throws VocabularyLookupException
     *     if this profile has no standard name for {@code variableName}.
     */
    public String standardNameOf(String variableName) {
        String standardName = standardNames.get(variableName);
        if (standardName == null) {
            throw new VocabularyLookupException(this + " has no standard_name for variable \"" + variableName + "\"");
        }
        return standardName;
    }

    /**
     * Gets whether variables get {@code standard_name} and {@code long_name} attributes.
     *
     * @return {@code true} for {@link #CF}.
     */
    public boolean namesVariables() {
        return this == CF;
    }

    /**
     * Gets whether the dataset is tagged with a {@code featureType}.
     *
     * @return {@code true} for {@link #UNITS_ONLY}.
     */
    public boolean tagsFeatureType() {
        return this == UNITS_ONLY;
    }

    /**
     * Gets whether the dataset gets a {@code history} attribute.
     *
     * @return {@code true} for {@link #CF}.
     */
    public boolean recordsHistory() {
        return this == CF;
    }

    /**
     * Gets the profile for a value given in a configuration file, like {@code units_only} or {@code cf}.
     *
     * @param configValue
     *     The configured value. Case is ignored.
     *
     * @return The profile.
     *
     * @throws NullPointerException
     *     if {@code configValue} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code configValue} doesn't name a profile.
     */
    public static MetadataProfile fromConfigValue(String configValue) {
        ArgumentUtil.checkNotNull(configValue, "metadata profile");
        for (MetadataProfile profile : values()) {
            if (profile.name().equalsIgnoreCase(configValue.trim())) {
                return profile;
            }
        }
        throw new IllegalArgumentException(
            "unknown metadata profile \"" + configValue + "\" (expected units_only or cf)");
    }

    /**
     * Gets the value which selects this profile in a configuration file.
     *
     * @return The configuration value, like {@code units_only}.
     */
    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
