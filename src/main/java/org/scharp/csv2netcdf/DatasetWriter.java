package org.scharp.csv2netcdf;

import java.nio.file.Path;

/**
 * Persists a fully annotated {@link Dataset}.
 */
public interface DatasetWriter {

    /**
     * Writes a dataset to a file.
     * <p>
     * If the file already exists, it is replaced.  If this method throws an exception, the file is left as it was
     * before (or absent), never partially written.
     * </p>
     *
     * @param dataset
     *     The dataset to write.
     * @param target
     *     The path of the file to write.  Its directory must exist.
     *
     * @throws PersistenceException
     *     if the file could not be created or finished.
     */
    void write(Dataset dataset, Path target) throws PersistenceException;
}
