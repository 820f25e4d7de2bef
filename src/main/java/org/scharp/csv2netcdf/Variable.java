///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named, one-dimensional variable of a {@link Dataset}, with its values and its attributes.
 * <p>
 * The name and values of a variable are fixed when it is created.  Attributes are added as the dataset is annotated
 * and keep the order in which they were first set.  Variable attributes are always strings.
 * </p>
 */
public final class Variable {

    private final String name;
    private final NumericColumn values;
    private final Map<String, String> attributes;

    /**
     * Creates a variable without attributes.
     *
     * @param name
     *     The variable's name.
     * @param values
     *     The variable's values.
     *
     * @throws NullPointerException
     *     if {@code name} or {@code values} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code name} is blank or exceeds 256 bytes in UTF-8.
     */
    public Variable(String name, NumericColumn values) {
        ArgumentUtil.checkNotBlank(name, "name");
        ArgumentUtil.checkMaximumLength(name, StandardCharsets.UTF_8, 256, "variable names");
        ArgumentUtil.checkNotNull(values, "values");

        this.name = name;
        this.values = values;
        this.attributes = new LinkedHashMap<>();
    }

    /**
     * Gets this variable's name.
     *
     * @return This variable's name. This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this variable's values.
     *
     * @return The values. This is never {@code null}.
     */
    public NumericColumn values() {
        return values;
    }

    /**
     * Gets the type in which this variable's values are held.
     *
     * @return The storage type. This is never {@code null}.
     */
    public StorageType storageType() {
        return values.storageType();
    }

    /**
     * Gets the number of values in this variable.
     *
     * @return The length.
     */
    public int length() {
        return values.length();
    }

    /**
     * Sets an attribute, replacing any previous value with the same name.
     *
     * @param attributeName
     *     The attribute's name.
     * @param value
     *     The attribute's value.
     *
     * @throws NullPointerException
     *     if {@code attributeName} or {@code value} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code attributeName} is blank.
     */
    public void setAttribute(String attributeName, String value) {
        ArgumentUtil.checkNotBlank(attributeName, "attributeName");
        ArgumentUtil.checkNotNull(value, "value");
        attributes.put(attributeName, value);
    }

    /**
     * Gets an attribute's value.
     *
     * @param attributeName
     *     The attribute's name.
     *
     * @return The value, or {@code null} if this variable has no such attribute.
     */
    public String attribute(String attributeName) {
        return attributes.get(attributeName);
    }

    /**
     * Gets all attributes of this variable.
     *
     * @return An unmodifiable view of the attributes in the order in which they were first set.
     */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return name + "(" + storageType() + "[" + length() + "])";
    }
}
