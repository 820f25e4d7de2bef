///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a headerless, comma-separated file into a {@link ColumnTable} according to a {@link SchemaDefinition}.
 * <p>
 * Values are assigned to fields by position.  The whole file is read into memory.  Each value is converted to its
 * field's {@link StorageType}:
 * </p>
 * <ul>
 *   <li>{@link StorageType#FLOAT64}: any decimal number, {@code NaN}, or an empty value (which is read as NaN).</li>
 *   <li>{@link StorageType#INT64} and {@link StorageType#INT32}: an integer, or a decimal number whose fraction is
 *   truncated toward zero.  The value must be in the type's range and must not be missing.</li>
 * </ul>
 * <p>
 * Blank lines are skipped.  If any line has the wrong number of values, or any value cannot be converted, no table is
 * returned.
 * </p>
 */
public final class RecordParser {

    private final SchemaDefinition schema;

    /**
     * Creates a parser for a schema.
     *
     * @param schema
     *     The fields which each line holds, in order.
     *
     * @throws NullPointerException
     *     if {@code schema} is {@code null}.
     */
    public RecordParser(SchemaDefinition schema) {
        ArgumentUtil.checkNotNull(schema, "schema");
        this.schema = schema;
    }

    /**
     * Reads a file.
     *
     * @param source
     *     The file to read.  It must be encoded in UTF-8 (or ASCII).
     *
     * @return The file's values, column by column, in the order of the schema's fields.  Row order is preserved.
     *
     * @throws NullPointerException
     *     if {@code source} is {@code null}.
     * @throws RecordFormatException
     *     if {@code source} can't be read, holds no records, has a line with the wrong number of values, or has a
     *     value that can't be converted to its field's type.
     */
    public ColumnTable parse(Path source) throws RecordFormatException {
        ArgumentUtil.checkNotNull(source, "source");

        List<String[]> rows = new ArrayList<>();
        List<Long> lineNumbers = new ArrayList<>();
        try (CSVReader csvReader = openCsv(source)) {
            while (true) {
                // The line on which the next record starts, for error messages.
                long lineNumber = csvReader.getLinesRead() + 1;
                String[] row = csvReader.readNext();
                if (row == null) {
                    break;
                }
                if (isBlank(row)) {
                    continue;
                }
                if (row.length != schema.columnCount()) {
                    throw new RecordFormatException(
                        source,
                        "line " + lineNumber + " has " + row.length + " values but " + schema.columnCount() +
                            " are expected");
                }
                rows.add(row);
                lineNumbers.add(lineNumber);
            }
        } catch (IOException | CsvValidationException e) {
            throw new RecordFormatException(source, "could not be read", e);
        }

        if (rows.isEmpty()) {
            throw new RecordFormatException(source, "contains no records");
        }

        Map<String, NumericColumn> columns = new LinkedHashMap<>();
        List<FieldDefinition> fields = schema.fields();
        for (int columnIndex = 0; columnIndex < fields.size(); columnIndex++) {
            FieldDefinition field = fields.get(columnIndex);
            columns.put(field.columnName(), toColumn(source, rows, lineNumbers, columnIndex, field));
        }
        return new ColumnTable(columns);
    }

    private static CSVReader openCsv(Path source) throws IOException {
        return new CSVReaderBuilder(Files.newBufferedReader(source, StandardCharsets.UTF_8))
            .withCSVParser(new CSVParserBuilder().withSeparator(',').withIgnoreLeadingWhiteSpace(true).build())
            .build();
    }

    private static boolean isBlank(String[] row) {
        return row.length == 1 && row[0].isBlank();
    }

    private static NumericColumn toColumn(Path source, List<String[]> rows, List<Long> lineNumbers, int columnIndex,
        FieldDefinition field) throws RecordFormatException {

        final int totalRows = rows.size();
        switch (field.storageType()) {
        case INT64: {
            long[] values = new long[totalRows];
            for (int i = 0; i < totalRows; i++) {
                String text = rows.get(i)[columnIndex];
                try {
                    values[i] = parseIntegral(text, Long.MIN_VALUE, Long.MAX_VALUE);
                } catch (NumberFormatException e) {
                    throw coercionError(source, lineNumbers.get(i), columnIndex, field, text, e);
                }
            }
            return NumericColumn.ofLongs(values);
        }

        case INT32: {
            int[] values = new int[totalRows];
            for (int i = 0; i < totalRows; i++) {
                String text = rows.get(i)[columnIndex];
                try {
                    values[i] = (int) parseIntegral(text, Integer.MIN_VALUE, Integer.MAX_VALUE);
                } catch (NumberFormatException e) {
                    throw coercionError(source, lineNumbers.get(i), columnIndex, field, text, e);
                }
            }
            return NumericColumn.ofInts(values);
        }

        default: {
            double[] values = new double[totalRows];
            for (int i = 0; i < totalRows; i++) {
                String text = rows.get(i)[columnIndex];
                try {
                    values[i] = parseDouble(text);
                } catch (NumberFormatException e) {
                    throw coercionError(source, lineNumbers.get(i), columnIndex, field, text, e);
                }
            }
            return NumericColumn.ofDoubles(values);
        }
        }
    }

    private static RecordFormatException coercionError(Path source, long lineNumber, int columnIndex,
        FieldDefinition field, String text, NumberFormatException cause) {
        String reason = text.isBlank() ? "a missing value" : "\"" + text.trim() + "\"";
        return new RecordFormatException(
            source,
            "line " + lineNumber + ", column " + (columnIndex + 1) + " (" + field.columnName() + "): cannot store " +
                reason + " as " + field.storageType(),
            cause);
    }

    /**
     * Parses a floating point value.
     *
     * @param text
     *     The text of the value.  Surrounding whitespace is ignored.
     *
     * @return The value, or NaN if {@code text} is blank.
     *
     * @throws NumberFormatException
     *     if {@code text} isn't a number.
     */
    static double parseDouble(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Double.NaN;
        }
        return Double.parseDouble(trimmed);
    }

    /**
     * Parses an integer value, truncating any fractional part toward zero.
     *
     * @param text
     *     The text of the value.  Surrounding whitespace is ignored.
     * @param minimum
     *     The smallest value allowed.
     * @param maximum
     *     The largest value allowed.
     *
     * @return The value.
     *
     * @throws NumberFormatException
     *     if {@code text} is blank, isn't a finite number, or is out of range.
     */
    static long parseIntegral(String text, long minimum, long maximum) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new NumberFormatException("missing values cannot be stored in an integer field");
        }

        // Check the range before truncating.  setScale() fails for exponents such as 1e999999999.
        BigDecimal value = new BigDecimal(trimmed);
        BigDecimal truncated = value.abs().compareTo(BigDecimal.ONE) < 0 ?
            BigDecimal.ZERO :
            value;
        if (truncated.compareTo(BigDecimal.valueOf(minimum).subtract(BigDecimal.ONE)) <= 0 ||
            truncated.compareTo(BigDecimal.valueOf(maximum).add(BigDecimal.ONE)) >= 0) {
            throw new NumberFormatException(trimmed + " is not between " + minimum + " and " + maximum);
        }
        return truncated.setScale(0, RoundingMode.DOWN).longValueExact();
    }
}
