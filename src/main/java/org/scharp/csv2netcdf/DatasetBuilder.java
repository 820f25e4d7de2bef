package org.scharp.csv2netcdf;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a {@link Dataset} from a parsed {@link ColumnTable}.
 * <p>
 * The schema's time field becomes the time coordinate; every other field becomes a data variable, in schema order.
 * Values are taken as they were parsed, so the time coordinate keeps the input's order and any duplicate timestamps.
 * </p>
 */
public final class DatasetBuilder {

    private final SchemaDefinition schema;

    /**
     * Creates a builder for a schema.
     *
     * @param schema
     *     The schema which the tables given to {@link #build} were parsed with.
     *
     * @throws NullPointerException
     *     if {@code schema} is {@code null}.
     */
    public DatasetBuilder(SchemaDefinition schema) {
        ArgumentUtil.checkNotNull(schema, "schema");
        this.schema = schema;
    }

    /**
     * Builds a dataset without attributes.
     *
     * @param table
     *     The parsed columns.
     *
     * @return A new dataset.
     *
     * @throws NullPointerException
     *     if {@code table} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code table} is missing one of the schema's columns or a column's type doesn't match its field's storage
     *     type.
     */
    public Dataset build(ColumnTable table) {
        ArgumentUtil.checkNotNull(table, "table");

        Variable time = toVariable(table, schema.timeField());

        List<Variable> dataVariables = new ArrayList<>(schema.dataFields().size());
        for (FieldDefinition field : schema.dataFields()) {
            dataVariables.add(toVariable(table, field));
        }

        // Dataset checks that every data variable is aligned with the time coordinate.
        return new Dataset(time, dataVariables);
    }

    private static Variable toVariable(ColumnTable table, FieldDefinition field) {
        NumericColumn column = table.column(field.columnName());
        if (column.storageType() != field.storageType()) {
            throw new IllegalArgumentException(
                "column \"" + field.columnName() + "\" holds " + column.storageType() +
                    " values but the schema declares " + field.storageType());
        }
        return new Variable(field.variableName(), column);
    }
}
