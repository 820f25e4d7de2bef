package org.scharp.csv2netcdf;

import java.util.Collection;
import java.util.Map;

/**
 * Copies deployment-specific global attributes (institution, license, contact, ...) onto a dataset.
 * <p>
 * The configured attributes are applied last, so they replace any computed attribute with the same name.  Empty
 * values are skipped: they are neither written nor used to remove an attribute.  A value is empty if it is
 * {@code null}, a blank string, {@code false}, zero, or an empty collection or map.
 * </p>
 */
public final class ConfiguredAttributeMerger {

    private final Map<String, Object> globalAttributes;

    /**
     * Creates a merger.
     *
     * @param globalAttributes
     *     The configured attributes, in the order in which they should be applied.  Values must be strings, numbers,
     *     booleans, or empty.  The map is not copied.
     *
     * @throws NullPointerException
     *     if {@code globalAttributes} is {@code null}.
     * @throws IllegalArgumentException
     *     if a name is blank or a non-empty value is not a string, number, or boolean.
     */
    public ConfiguredAttributeMerger(Map<String, Object> globalAttributes) {
        ArgumentUtil.checkNotNull(globalAttributes, "globalAttributes");
        for (Map.Entry<String, Object> entry : globalAttributes.entrySet()) {
            checkAttribute(entry.getKey(), entry.getValue());
        }
        this.globalAttributes = globalAttributes;
    }

    /**
     * Merges the configured attributes into a dataset.
     *
     * @param dataset
     *     The dataset.
     *
     * @throws NullPointerException
     *     if {@code dataset} is {@code null}.
     */
    public void merge(Dataset dataset) {
        ArgumentUtil.checkNotNull(dataset, "dataset");

        for (Map.Entry<String, Object> entry : globalAttributes.entrySet()) {
            Object value = entry.getValue();
            if (isEmpty(value)) {
                continue;
            }
            // NetCDF has no boolean type. Only true can reach this point.
            dataset.setAttribute(entry.getKey(), value instanceof Boolean ? value.toString() : value);
        }
    }

    /**
     * Checks that a configured attribute can be written.
     *
     * @param name
     *     The attribute's name.
     * @param value
     *     The configured value.
     *
     * @throws NullPointerException
     *     if {@code name} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code name} is blank or {@code value} is neither empty nor a string, number, or boolean.
     */
    static void checkAttribute(String name, Object value) {
        ArgumentUtil.checkNotBlank(name, "global attribute names");
        if (!isEmpty(value) && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException(
                "global attribute \"" + name + "\" must be a string, number, or boolean");
        }
    }

    /**
     * Determines whether a configured value is empty.
     *
     * @param value
     *     The value.
     *
     * @return {@code true}, if the value should be skipped.
     */
    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Boolean flag) {
            return !flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }
}
