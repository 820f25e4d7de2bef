///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An in-memory time series: one time coordinate, data variables that are indexed by it, and global attributes.
 * <p>
 * Every data variable has the same length as the time coordinate, so the value at index {@code i} of any data variable
 * was observed at the time at index {@code i}.  The time coordinate is neither required to be sorted nor to be
 * unique.
 * </p>
 * <p>
 * Global attributes are either a {@link String} or a {@link Number}.  They keep the order in which they were first
 * set; setting an attribute that already exists replaces its value in place.
 * </p>
 */
public final class Dataset {

    private final Variable time;
    private final List<Variable> dataVariables;
    private final Map<String, Object> attributes;

    /**
     * Creates a dataset without global attributes.
     *
     * @param time
     *     The time coordinate.
     * @param dataVariables
     *     The data variables, in the order in which they should be written. This list is copied.
     *
     * @throws NullPointerException
     *     if {@code time} or {@code dataVariables} is {@code null}, or if {@code dataVariables} contains a
     *     {@code null} entry.
     * @throws IllegalArgumentException
     *     if a data variable's length differs from the time coordinate's length, or if two variables share a name.
     */
    public Dataset(Variable time, List<Variable> dataVariables) {
        ArgumentUtil.checkNotNull(time, "time");
        ArgumentUtil.checkNotNull(dataVariables, "dataVariables");

        Set<String> names = new HashSet<>();
        names.add(time.name());
        List<Variable> copy = new ArrayList<>(dataVariables.size());
        for (Variable variable : dataVariables) {
            if (variable == null) {
                throw new NullPointerException("dataVariables cannot contain a null entry");
            }
            if (variable.length() != time.length()) {
                throw new IllegalArgumentException(
                    "variable \"" + variable.name() + "\" has " + variable.length() +
                        " values but the time coordinate has " + time.length());
            }
            if (!names.add(variable.name())) {
                throw new IllegalArgumentException("dataset contains two variables named \"" + variable.name() + "\"");
            }
            copy.add(variable);
        }

        this.time = time;
        this.dataVariables = Collections.unmodifiableList(copy);
        this.attributes = new LinkedHashMap<>();
    }

    /**
     * Gets the time coordinate.
     *
     * @return The time coordinate. This is never {@code null}.
     */
    public Variable time() {
        return time;
    }

    /**
     * Gets the data variables.
     *
     * @return An unmodifiable list of the data variables.
     */
    public List<Variable> dataVariables() {
        return dataVariables;
    }

    /**
     * Gets every variable, the time coordinate first.
     *
     * @return A new list.
     */
    public List<Variable> variables() {
        List<Variable> variables = new ArrayList<>(dataVariables.size() + 1);
        variables.add(time);
        variables.addAll(dataVariables);
        return variables;
    }

    /**
     * Gets a variable by name.  The time coordinate can be found by its name, too.
     *
     * @param name
     *     The variable's name.
     *
     * @return The variable.
     *
     * @throws IllegalArgumentException
     *     if this dataset has no variable named {@code name}.
     */
    public Variable variable(String name) {
        if (time.name().equals(name)) {
            return time;
        }
        for (Variable variable : dataVariables) {
            if (variable.name().equals(name)) {
                return variable;
            }
        }
        throw new IllegalArgumentException("dataset has no variable named \"" + name + "\"");
    }

    /**
     * Gets the number of time steps.
     *
     * @return The length of the time coordinate (and every data variable).
     */
    public int length() {
        return time.length();
    }

    /**
     * Sets a global attribute, replacing any previous value with the same name.
     *
     * @param attributeName
     *     The attribute's name.
     * @param value
     *     The attribute's value.  This must be a {@link String} or a {@link Number}.
     *
     * @throws NullPointerException
     *     if {@code attributeName} or {@code value} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code attributeName} is blank or {@code value} is neither a string nor a number.
     */
    public void setAttribute(String attributeName, Object value) {
        ArgumentUtil.checkNotBlank(attributeName, "attributeName");
        ArgumentUtil.checkNotNull(value, "value");
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new IllegalArgumentException(
                "attribute \"" + attributeName + "\" must be a string or a number, not " + value.getClass().getName());
        }
        attributes.put(attributeName, value);
    }

    /**
     * Gets a global attribute's value.
     *
     * @param attributeName
     *     The attribute's name.
     *
     * @return The value, or {@code null} if there is no such attribute.
     */
    public Object attribute(String attributeName) {
        return attributes.get(attributeName);
    }

    /**
     * Gets all global attributes.
     *
     * @return An unmodifiable view of the global attributes in the order in which they were first set.
     */
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }
}
