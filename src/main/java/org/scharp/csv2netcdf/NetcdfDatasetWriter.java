package org.scharp.csv2netcdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFileWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes datasets as NetCDF-3 classic files with netcdf-java.
 * <p>
 * The time coordinate becomes both the {@code time} dimension and a {@code time} variable.  Types are mapped as
 * follows:
 * </p>
 * <ul>
 *   <li>{@link StorageType#INT64} (the time coordinate) is written as {@code double}, because the classic format has
 *   no 64-bit integer type.</li>
 *   <li>{@link StorageType#INT32} is written as {@code int}.</li>
 *   <li>{@link StorageType#FLOAT64} is written as {@code double}.</li>
 * </ul>
 * <p>
 * Numeric global attributes are written as {@code int} if they are {@link Integer}, {@link Short} or {@link Byte} and
 * as {@code double} otherwise.
 * </p>
 * <p>
 * The file is first written next to the target under a temporary name and then moved into place, so that a failure
 * never leaves a partially written file under the target's name.
 * </p>
 */
public final class NetcdfDatasetWriter implements DatasetWriter {
    private static final Logger logger = LoggerFactory.getLogger(NetcdfDatasetWriter.class);

    static final String TIME_DIMENSION = SchemaDefinition.TIME_VARIABLE;

    @Override
    public void write(Dataset dataset, Path target) throws PersistenceException {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(target, "target");

        Path temporaryFile = target.resolveSibling("." + target.getFileName() + ".part");
        try {
            Files.deleteIfExists(temporaryFile);
            logger.debug("Writing {} time steps to {}", dataset.length(), temporaryFile);
            writeNetcdf(dataset, temporaryFile);
            Files.move(temporaryFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | InvalidRangeException | RuntimeException e) {
            PersistenceException exception = new PersistenceException(target, "could not write NetCDF file", e);
            try {
                Files.deleteIfExists(temporaryFile);
            } catch (IOException cleanupException) {
                exception.addSuppressed(cleanupException);
            }
            throw exception;
        }
    }

    private static void writeNetcdf(Dataset dataset, Path location) throws IOException, InvalidRangeException {
        NetcdfFileWriter writer = NetcdfFileWriter.createNew(NetcdfFileWriter.Version.netcdf3, location.toString());
        try {
            // Define mode: dimensions, variables and attributes.
            writer.addDimension(null, TIME_DIMENSION, dataset.length());

            List<Variable> variables = dataset.variables();
            List<ucar.nc2.Variable> netcdfVariables = new ArrayList<>(variables.size());
            for (Variable variable : variables) {
                ucar.nc2.Variable netcdfVariable = writer.addVariable(
                    null,
                    variable.name(),
                    dataTypeOf(variable.storageType()),
                    TIME_DIMENSION);
                for (Map.Entry<String, String> attribute : variable.attributes().entrySet()) {
                    writer.addVariableAttribute(
                        netcdfVariable,
                        new Attribute(attribute.getKey(), attribute.getValue()));
                }
                netcdfVariables.add(netcdfVariable);
            }

            for (Map.Entry<String, Object> attribute : dataset.attributes().entrySet()) {
                writer.addGroupAttribute(null, toAttribute(attribute.getKey(), attribute.getValue()));
            }

            writer.create();

            // Data mode.
            for (int i = 0; i < variables.size(); i++) {
                writer.write(netcdfVariables.get(i), toArray(variables.get(i).values()));
            }
        } catch (IOException | InvalidRangeException | RuntimeException e) {
            // Release the file handle before the caller tries to delete the file.
            try {
                writer.close();
            } catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
        writer.close();
    }

    static DataType dataTypeOf(StorageType storageType) {
        return storageType == StorageType.INT32 ? DataType.INT : DataType.DOUBLE;
    }

    static Array toArray(NumericColumn column) {
        if (column.storageType() == StorageType.INT32) {
            return Array.factory(column.toJavaArray());
        }
        return Array.factory(column.toDoubleArray());
    }

    static Attribute toAttribute(String name, Object value) {
        if (value instanceof String text) {
            return new Attribute(name, text);
        }
        Number number = (Number) value;
        if (number instanceof Integer || number instanceof Short || number instanceof Byte ||
            number instanceof Double) {
            return new Attribute(name, number);
        }
        return new Attribute(name, number.doubleValue());
    }
}
