package org.scharp.csv2netcdf;

import java.nio.file.Path;

/**
 * Indicates that a {@link DatasetWriter} could not create or finish an output file.  When this is thrown, no partially
 * written output file exists.
 */
public class PersistenceException extends ConversionException {

    /**
     * Creates an exception for an output file.
     *
     * @param file
     *     The output file that could not be written.
     * @param message
     *     A description of the problem.
     * @param cause
     *     The underlying problem.
     */
    public PersistenceException(Path file, String message, Throwable cause) {
        super(file, message, cause);
    }
}
