package org.scharp.csv2netcdf;

import java.nio.file.Path;

/**
 * A class for holding utility methods on file names.
 */
abstract class FileNames {

    /** The extension of the files that are written */
    static final String NETCDF_EXTENSION = ".nc";

    // private constructor to prevent anyone from instantiating the class.
    private FileNames() {
    }

    /**
     * Gets a file's name without its directory and without its extension.
     * <p>
     * Only the last extension is removed ("{@code a.b.csv}" becomes "{@code a.b}").  Leading dots don't start an
     * extension, so "{@code .profile}" is returned unchanged.
     * </p>
     *
     * @param path
     *     The path of the file.
     *
     * @return The base name.
     */
    static String baseName(Path path) {
        assert path != null : "path must not be null";

        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dotIndex = name.lastIndexOf('.');
        for (int i = 0; i < dotIndex; i++) {
            if (name.charAt(i) != '.') {
                return name.substring(0, dotIndex);
            }
        }
        return name;
    }

    /**
     * Gets the path of the NetCDF file which a source file is converted into.
     *
     * @param source
     *     The source file.
     * @param outputDirectory
     *     The directory into which NetCDF files are written.
     *
     * @return {@code outputDirectory/<base name of source>.nc}
     */
    static Path netcdfFileFor(Path source, Path outputDirectory) {
        return outputDirectory.resolve(baseName(source) + NETCDF_EXTENSION);
    }
}
