///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.util.Locale;
import java.util.Map;

/**
 * How the observed quantities are typed.
 * <p>
 * A policy is a table of per-field overrides on top of {@link StorageType#FLOAT64}.  It is consulted only while the
 * {@link SchemaDefinition} is being created, so each {@link FieldDefinition} carries its final storage type.
 * </p>
 */
public enum NumericPolicy {

    /**
     * Every observed quantity is a double.
     */
    ALL_FLOAT(Map.of()),

    /**
     * Wind direction and humidity, which stations report in whole units, are 32-bit integers. Everything else is a
     * double.
     */
    MIXED(Map.of(
        "true_wind_direction", StorageType.INT32,
        "air_humidity", StorageType.INT32));

    private final Map<String, StorageType> overrides;

    NumericPolicy(Map<String, StorageType> overrides) {
        this.overrides = overrides;
    }

    /**
     * Gets the storage type that this policy assigns to an observed quantity.
     *
     * @param columnName
     *     The name of the input column.
     *
     * @return The storage type. This is never {@code null}.
     */
    StorageType storageTypeOf(String columnName) {
        return overrides.getOrDefault(columnName, StorageType.FLOAT64);
    }

    /**
     * Gets the policy for a value given in a configuration file, like {@code all_float} or {@code mixed}.
     *
     * @param configValue
     *     The configured value. Case is ignored.
     *
     * @return The policy.
     *
     * @throws NullPointerException
     *     if {@code configValue} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code configValue} doesn't name a policy.
     */
    public static NumericPolicy fromConfigValue(String configValue) {
        ArgumentUtil.checkNotNull(configValue, "numeric policy");
        for (NumericPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(configValue.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
            "unknown numeric policy \"" + configValue + "\" (expected all_float or mixed)");
    }

    /**
     * Gets the value which selects this policy in a configuration file.
     *
     * @return The configuration value, like {@code all_float}.
     */
    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
