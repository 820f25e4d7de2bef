///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed input held column by column.
 * <p>
 * Instances of this class are immutable.  Columns keep the order in which they were given and all have the same
 * length.
 * </p>
 */
public final class ColumnTable {

    private final Map<String, NumericColumn> columns;
    private final int rowCount;

    /**
     * Creates a table.
     *
     * @param columns
     *     The columns, keyed by column name, in input order. The map is copied.
     *
     * @throws NullPointerException
     *     if {@code columns} is {@code null} or holds a {@code null} column.
     * @throws IllegalArgumentException
     *     if {@code columns} is empty or the columns have different lengths.
     */
    public ColumnTable(Map<String, NumericColumn> columns) {
        ArgumentUtil.checkNotNull(columns, "columns");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }

        int expectedLength = -1;
        for (Map.Entry<String, NumericColumn> entry : columns.entrySet()) {
            if (entry.getValue() == null) {
                throw new NullPointerException("column \"" + entry.getKey() + "\" must not be null");
            }
            int length = entry.getValue().length();
            if (expectedLength == -1) {
                expectedLength = length;
            } else if (length != expectedLength) {
                throw new IllegalArgumentException(
                    "column \"" + entry.getKey() + "\" has " + length + " rows but the table has " + expectedLength);
            }
        }

        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.rowCount = expectedLength;
    }

    /**
     * Gets the number of rows.
     *
     * @return The length of every column.
     */
    public int rowCount() {
        return rowCount;
    }

    /**
     * Gets the names of the columns in input order.
     *
     * @return An unmodifiable list.
     */
    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Gets a column by name.
     *
     * @param columnName
     *     The column's name.
     *
     * @return The column.
     *
     * @throws IllegalArgumentException
     *     if this table has no column named {@code columnName}.
     */
    public NumericColumn column(String columnName) {
        NumericColumn column = columns.get(columnName);
        if (column == null) {
            throw new IllegalArgumentException("no column named \"" + columnName + "\"");
        }
        return column;
    }
}
