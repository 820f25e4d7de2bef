///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Objects;

/**
 * One positional field of the input: the name of its column, the name of the variable it becomes, and the type in
 * which its values are held.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link FieldDefinition.Builder}:
 * </p>
 *
 * <pre>
 * FieldDefinition windSpeed = FieldDefinition.builder().
 *     columnName("true_wind_speed").
 *     storageType(StorageType.FLOAT64).
 *     build();
 * </pre>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a
 * {@code HashMap}.
 * </p>
 */
public final class FieldDefinition {

    /** NetCDF-3 limits names to 256 bytes */
    private static final int MAX_NAME_LENGTH = 256;

    private final String columnName;
    private final String variableName;
    private final StorageType storageType;

    /**
     * A builder class for {@link FieldDefinition}.
     */
    public final static class Builder {
        private String columnName;
        private String variableName;
        private StorageType storageType;

        /**
         * Creates a {@code FieldDefinition} builder.
         */
        private Builder() {
            this.columnName = null; // required parameter
            this.variableName = null; // optional, so default to the column name
            this.storageType = null; // required parameter
        }

        /**
         * Sets the name of the input column.
         *
         * @param columnName
         *     The column's name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code columnName} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code columnName} is blank or exceeds 256 bytes in UTF-8.
         */
        public Builder columnName(String columnName) {
            checkName(columnName, "columnName", "column names");
            this.columnName = columnName;
            return this;
        }

        /**
         * Sets the name of the variable which the column becomes. If this is not set, the variable has the same name
         * as the column.
         *
         * @param variableName
         *     The variable's name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code variableName} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code variableName} is blank or exceeds 256 bytes in UTF-8.
         */
        public Builder variableName(String variableName) {
            checkName(variableName, "variableName", "variable names");
            this.variableName = variableName;
            return this;
        }

        /**
         * Sets the type in which the field's values are held.
         *
         * @param storageType
         *     The field's storage type.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code storageType} is {@code null}.
         */
        public Builder storageType(StorageType storageType) {
            ArgumentUtil.checkNotNull(storageType, "storageType");
            this.storageType = storageType;
            return this;
        }

        private static void checkName(String name, String argumentName, String description) {
            ArgumentUtil.checkNotNull(name, argumentName);
            if (name.isBlank()) {
                throw new IllegalArgumentException(description + " cannot be blank");
            }
            ArgumentUtil.checkMaximumLength(name, StandardCharsets.UTF_8, MAX_NAME_LENGTH, description);
        }

        /**
         * Builds an immutable {@code FieldDefinition} with the configured options.
         *
         * @return a {@code FieldDefinition}
         *
         * @throws IllegalStateException
         *     if the column name or storage type haven't been set.
         */
        public FieldDefinition build() {
            if (columnName == null) {
                throw new IllegalStateException("columnName must be set");
            }
            if (storageType == null) {
                throw new IllegalStateException("storageType must be set");
            }
            return new FieldDefinition(columnName, variableName == null ? columnName : variableName, storageType);
        }
    }

    /**
     * Creates a new FieldDefinition builder whose variable name defaults to the column name.
     * <p>
     * You must set the column name and storage type before invoking {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private FieldDefinition(String columnName, String variableName, StorageType storageType) {
        this.columnName = columnName;
        this.variableName = variableName;
        this.storageType = storageType;
    }

    /**
     * Gets the name of the input column.
     *
     * @return The column name. This is never {@code null}.
     */
    public String columnName() {
        return columnName;
    }

    /**
     * Gets the name of the variable that this field becomes.
     *
     * @return The variable name. This is never {@code null}.
     */
    public String variableName() {
        return variableName;
    }

    /**
     * Gets the type in which this field's values are held.
     *
     * @return The storage type. This is never {@code null}.
     */
    public StorageType storageType() {
        return storageType;
    }

    /**
     * Gets a hash code for this field.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This field's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(columnName, variableName, storageType);
    }

    /**
     * Determines if this field is equal to another object.
     * <p>
     * Two fields are equal if and only if their column name, variable name, and storage type are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this field.
     *
     * @return {@code true}, if this field is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FieldDefinition otherField)) {
            return false;
        }

        return columnName.equals(otherField.columnName) &&
            variableName.equals(otherField.variableName) &&
            storageType == otherField.storageType;
    }

    @Override
    public String toString() {
        return columnName + "->" + variableName + "(" + storageType + ")";
    }
}
