///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The ordered catalog of the fields in a weather station's telemetry.
 * <p>
 * The first field is the time coordinate.  Every other field is an observed quantity which becomes a data variable
 * indexed by time.
 * </p>
 */
public final class SchemaDefinition {

    /** The name of the input column which holds the timestamp */
    public static final String TIMESTAMP_COLUMN = "timestamp";

    /** The name of the time coordinate variable */
    public static final String TIME_VARIABLE = "time";

    /** The observed quantities, in the order in which they appear in each line after the timestamp */
    static final List<String> OBSERVED_COLUMNS = List.of(
        "latitude",
        "longitude",
        "true_wind_speed",
        "true_wind_direction",
        "air_temperature",
        "air_humidity",
        "dew_point",
        "immediate_air_pressure",
        "average_air_pressure_for_last_minute",
        "sea_level_air_pressure");

    private final List<FieldDefinition> fields;

    /**
     * Gets the schema of the weather station telemetry.
     *
     * @param numericPolicy
     *     The policy that types the observed quantities.
     *
     * @return The schema of the eleven fields.
     *
     * @throws NullPointerException
     *     if {@code numericPolicy} is {@code null}.
     */
    public static SchemaDefinition stationTelemetry(NumericPolicy numericPolicy) {
        ArgumentUtil.checkNotNull(numericPolicy, "numericPolicy");

        List<FieldDefinition> fields = new ArrayList<>(OBSERVED_COLUMNS.size() + 1);
        fields.add(FieldDefinition.builder().
            columnName(TIMESTAMP_COLUMN).
            variableName(TIME_VARIABLE).
            storageType(StorageType.INT64).
            build());
        for (String columnName : OBSERVED_COLUMNS) {
            fields.add(FieldDefinition.builder().
                columnName(columnName).
                storageType(numericPolicy.storageTypeOf(columnName)).
                build());
        }
        return new SchemaDefinition(fields);
    }

    /**
     * Creates a schema from a list of fields.
     *
     * @param fields
     *     The fields in input order.  The first field is the time coordinate.  This list is copied.
     *
     * @throws NullPointerException
     *     if {@code fields} is {@code null} or contains a {@code null} entry.
     * @throws IllegalArgumentException
     *     if {@code fields} has fewer than two entries or two fields share a column name or a variable name.
     */
    public SchemaDefinition(List<FieldDefinition> fields) {
        ArgumentUtil.checkNotNull(fields, "fields");
        if (fields.size() < 2) {
            throw new IllegalArgumentException("a schema needs a time field and at least one data field");
        }

        Set<String> columnNames = new HashSet<>();
        Set<String> variableNames = new HashSet<>();
        for (FieldDefinition field : fields) {
            if (field == null) {
                throw new NullPointerException("fields cannot contain a null entry");
            }
            if (!columnNames.add(field.columnName())) {
                throw new IllegalArgumentException("fields contains two columns named \"" + field.columnName() + "\"");
            }
            if (!variableNames.add(field.variableName())) {
                throw new IllegalArgumentException(
                    "fields contains two variables named \"" + field.variableName() + "\"");
            }
        }
        this.fields = List.copyOf(fields);
    }

    /**
     * Gets all fields in input order.
     *
     * @return An unmodifiable list of fields.
     */
    public List<FieldDefinition> fields() {
        return fields;
    }

    /**
     * Gets the number of columns which each input line must have.
     *
     * @return The column count.
     */
    public int columnCount() {
        return fields.size();
    }

    /**
     * Gets the field that holds the time coordinate.
     *
     * @return The first field.
     */
    public FieldDefinition timeField() {
        return fields.get(0);
    }

    /**
     * Gets the fields that become data variables.
     *
     * @return An unmodifiable list of every field but the first.
     */
    public List<FieldDefinition> dataFields() {
        return Collections.unmodifiableList(fields.subList(1, fields.size()));
    }
}
