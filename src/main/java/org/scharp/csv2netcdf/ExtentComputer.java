///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

/**
 * Computes the spatial and temporal coverage of a dataset and records it as global attributes.
 * <p>
 * The bounds are the smallest and largest non-missing values of {@code latitude}, {@code longitude} and the time
 * coordinate.  Missing (NaN) values are ignored.  If a variable has no valid value at all, both of its bounds are NaN;
 * such a dataset can still be written.
 * </p>
 * <p>
 * All bounds are recorded as {@link Double}.  The time bounds are in the units of the time coordinate (seconds since
 * 1970-01-01T00:00:00Z).
 * </p>
 */
public final class ExtentComputer {

    static final String GEOSPATIAL_LAT_MIN = "geospatial_lat_min";
    static final String GEOSPATIAL_LAT_MAX = "geospatial_lat_max";
    static final String GEOSPATIAL_LON_MIN = "geospatial_lon_min";
    static final String GEOSPATIAL_LON_MAX = "geospatial_lon_max";
    static final String TIME_COVERAGE_START = "time_coverage_start";
    static final String TIME_COVERAGE_END = "time_coverage_end";

    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";

    /**
     * Records the coverage of a dataset.
     *
     * @param dataset
     *     The dataset.  It must have a {@code latitude} and a {@code longitude} variable.
     *
     * @throws NullPointerException
     *     if {@code dataset} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code dataset} has no {@code latitude} or no {@code longitude} variable.
     */
    public void computeExtents(Dataset dataset) {
        ArgumentUtil.checkNotNull(dataset, "dataset");

        Variable latitude = dataset.variable(LATITUDE);
        Variable longitude = dataset.variable(LONGITUDE);
        Variable time = dataset.time();

        dataset.setAttribute(GEOSPATIAL_LAT_MIN, nanMin(latitude.values()));
        dataset.setAttribute(GEOSPATIAL_LAT_MAX, nanMax(latitude.values()));
        dataset.setAttribute(GEOSPATIAL_LON_MIN, nanMin(longitude.values()));
        dataset.setAttribute(GEOSPATIAL_LON_MAX, nanMax(longitude.values()));
        dataset.setAttribute(TIME_COVERAGE_START, nanMin(time.values()));
        dataset.setAttribute(TIME_COVERAGE_END, nanMax(time.values()));
    }

    /**
     * Gets the smallest value in a column, ignoring NaN.
     *
     * @param column
     *     The column.
     *
     * @return The smallest value, or NaN if the column holds no value other than NaN.
     */
    static double nanMin(NumericColumn column) {
        double minimum = Double.NaN;
        for (int i = 0; i < column.length(); i++) {
            double value = column.getDouble(i);
            // A comparison with NaN is always false, so the first valid value replaces the initial NaN.
            if (!Double.isNaN(value) && !(minimum <= value)) {
                minimum = value;
            }
        }
        return minimum;
    }

    /**
     * Gets the largest value in a column, ignoring NaN.
     *
     * @param column
     *     The column.
     *
     * @return The largest value, or NaN if the column holds no value other than NaN.
     */
    static double nanMax(NumericColumn column) {
        double maximum = Double.NaN;
        for (int i = 0; i < column.length(); i++) {
            double value = column.getDouble(i);
            if (!Double.isNaN(value) && !(value <= maximum)) {
                maximum = value;
            }
        }
        return maximum;
    }
}
