package org.scharp.csv2netcdf;

import java.nio.file.Path;

/**
 * Indicates that an input file could not be read into the fixed schema, either because a line doesn't have the right
 * number of values or because a value can't be converted to its field's type.
 */
public class RecordFormatException extends ConversionException {

    RecordFormatException(Path file, String message) {
        super(file, message);
    }

    RecordFormatException(Path file, String message, Throwable cause) {
        super(file, message, cause);
    }
}
