package org.scharp.csv2netcdf;

import java.nio.file.Path;

/**
 * Indicates that the configuration is missing a required setting or has a malformed one.
 */
public class ConfigurationException extends ConversionException {

    ConfigurationException(Path file, String message) {
        super(file, message);
    }

    ConfigurationException(Path file, String message, Throwable cause) {
        super(file, message, cause);
    }
}
