package org.scharp.csv2netcdf;

import java.nio.file.Path;

/**
 * Indicates that a file could not be converted.
 * <p>
 * Every subclass names the file that caused the problem.  The message is prefixed with that file's path.
 * </p>
 */
public abstract class ConversionException extends Exception {

    private final Path file;

    ConversionException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    ConversionException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    /**
     * Gets the file which caused this exception.
     *
     * @return The path of the file.  This is never {@code null}.
     */
    public Path file() {
        return file;
    }
}
