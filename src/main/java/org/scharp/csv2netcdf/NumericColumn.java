///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.util.Arrays;

/**
 * An immutable one-dimensional array of numbers that are all of the same {@link StorageType}.
 */
public final class NumericColumn {

    private final StorageType storageType;

    // Exactly one of these is non-null, depending on storageType.
    private final long[] longValues;
    private final int[] intValues;
    private final double[] doubleValues;

    private NumericColumn(StorageType storageType, long[] longValues, int[] intValues, double[] doubleValues) {
        this.storageType = storageType;
        this.longValues = longValues;
        this.intValues = intValues;
        this.doubleValues = doubleValues;
    }

    /**
     * Creates a column of 64-bit integers.
     *
     * @param values
     *     The values. These are copied.
     *
     * @return A new {@link StorageType#INT64} column.
     */
    public static NumericColumn ofLongs(long... values) {
        ArgumentUtil.checkNotNull(values, "values");
        return new NumericColumn(StorageType.INT64, values.clone(), null, null);
    }

    /**
     * Creates a column of 32-bit integers.
     *
     * @param values
     *     The values. These are copied.
     *
     * @return A new {@link StorageType#INT32} column.
     */
    public static NumericColumn ofInts(int... values) {
        ArgumentUtil.checkNotNull(values, "values");
        return new NumericColumn(StorageType.INT32, null, values.clone(), null);
    }

    /**
     * Creates a column of doubles.
     *
     * @param values
     *     The values. These are copied. NaN marks a missing value.
     *
     * @return A new {@link StorageType#FLOAT64} column.
     */
    public static NumericColumn ofDoubles(double... values) {
        ArgumentUtil.checkNotNull(values, "values");
        return new NumericColumn(StorageType.FLOAT64, null, null, values.clone());
    }

    /**
     * Gets the type of this column's values.
     *
     * @return The storage type. This is never {@code null}.
     */
    public StorageType storageType() {
        return storageType;
    }

    /**
     * Gets the number of values in this column.
     *
     * @return The length.
     */
    public int length() {
        switch (storageType) {
        case INT64:
            return longValues.length;
        case INT32:
            return intValues.length;
        default:
            return doubleValues.length;
        }
    }

    /**
     * Gets a value, widened to a double.
     *
     * @param index
     *     The zero-based index of the value.
     *
     * @return The value.
     *
     * @throws ArrayIndexOutOfBoundsException
     *     if {@code index} is out of range.
     */
    public double getDouble(int index) {
        switch (storageType) {
        case INT64:
            return longValues[index];
        case INT32:
            return intValues[index];
        default:
            return doubleValues[index];
        }
    }

    /**
     * Gets a value of an integer column.
     *
     * @param index
     *     The zero-based index of the value.
     *
     * @return The value.
     *
     * @throws IllegalStateException
     *     if this is a {@link StorageType#FLOAT64} column.
     * @throws ArrayIndexOutOfBoundsException
     *     if {@code index} is out of range.
     */
    public long getLong(int index) {
        switch (storageType) {
        case INT64:
            return longValues[index];
        case INT32:
            return intValues[index];
        default:
            throw new IllegalStateException("cannot read an integer from a " + storageType + " column");
        }
    }

    /**
     * Copies this column into a new Java array of its natural type: {@code long[]}, {@code int[]} or
     * {@code double[]}.
     *
     * @return A new array which the caller may modify.
     */
    public Object toJavaArray() {
        switch (storageType) {
        case INT64:
            return longValues.clone();
        case INT32:
            return intValues.clone();
        default:
            return doubleValues.clone();
        }
    }

    /**
     * Copies this column into a new array of doubles.
     *
     * @return A new array which the caller may modify.
     */
    public double[] toDoubleArray() {
        switch (storageType) {
        case INT64:
            return Arrays.stream(longValues).asDoubleStream().toArray();
        case INT32:
            return Arrays.stream(intValues).asDoubleStream().toArray();
        default:
            return doubleValues.clone();
        }
    }
}
