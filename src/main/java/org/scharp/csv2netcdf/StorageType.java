///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

/**
 * The numeric type in which a field's values are held.
 */
public enum StorageType {
    /** A 64-bit signed integer. Missing values cannot be represented. */
    INT64,

    /** A 32-bit signed integer. Missing values cannot be represented. */
    INT32,

    /** An IEEE 754 double precision floating point value. Missing values are NaN. */
    FLOAT64,
}
