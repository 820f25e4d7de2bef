///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library converts the comma-separated telemetry written by marine weather stations into self-describing
 * NetCDF files.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.csv2netcdf.CsvToNetcdfConverter} for sample code on converting a file.
 * </p>
 *
 * <h2>A NetCDF Primer for Java Programmers</h2>
 *
 * <p>
 * A NetCDF file holds named, typed arrays ("variables") that share named axes ("dimensions"). Every variable and the
 * file as a whole can carry attributes: small name/value pairs that describe the data. A variable whose name matches
 * its only dimension is a "coordinate variable"; in the files written by this library, {@code time} is the single
 * coordinate and the ten observed quantities are indexed by it.
 * </p>
 *
 * <p>
 * The attributes are what make a file self-describing. The Climate and Forecast (CF) conventions standardize a
 * {@code units} attribute, a {@code standard_name} taken from a controlled vocabulary, and a free-text
 * {@code long_name}. The Attribute Convention for Data Discovery (ACDD) adds file-level attributes such as
 * {@code geospatial_lat_min} or {@code time_coverage_end} so that a catalog can index a file without reading its
 * data. Which of these attributes are written is selected by a {@link org.scharp.csv2netcdf.MetadataProfile}.
 * </p>
 *
 * <p>
 * The input format is fixed. Each line has exactly eleven comma-separated values and there is no header:
 * </p>
 * <pre>
 * timestamp,latitude,longitude,true_wind_speed,true_wind_direction,air_temperature,air_humidity,
 *     dew_point,immediate_air_pressure,average_air_pressure_for_last_minute,sea_level_air_pressure
 * </pre>
 *
 * <p>
 * The timestamp is in seconds since 1970-01-01T00:00:00Z.  An empty cell (or {@code NaN}) is a missing value, which is
 * stored as NaN.  Only floating point variables can hold a missing value.
 * </p>
 *
 * <p>
 * This library writes the NetCDF-3 "classic" format, which every NetCDF reader supports.  The classic format has no
 * 64-bit integer type, so the time coordinate is written as a double.  Whole seconds up to 2<sup>53</sup> are exact in
 * a double.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * A problem with the input or the output is reported with a checked {@link org.scharp.csv2netcdf.ConversionException}
 * that names the file that caused it.  Misuse of the API (such as passing {@code null}) is reported with the usual
 * unchecked exceptions as soon as possible (fail-fast).  Conversions never leave a partially written NetCDF file
 * behind: an output file is either complete or absent.
 * </p>
 */
package org.scharp.csv2netcdf;
