package com.libragraph.archive.formats.container;

import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;

import java.util.Map;

/**
 * {@link DataContainer} backed by a jHDF {@link HdfFile}.
 * Compound datasets are returned by jHDF as a map of member name to column array.
 */
class Hdf5Container implements DataContainer {

    private final HdfFile file;
    private final String filename;

    Hdf5Container(HdfFile file, String filename) {
        this.file = file;
        this.filename = filename;
    }

    @Override
    public boolean contains(String path) {
        try {
            Node node = file.getByPath(path);
            return node instanceof Dataset;
        } catch (HdfException e) {
            return false;
        }
    }

    @Override
    public int length(String path) {
        int[] dims = dataset(path).getDimensions();
        if (dims.length == 0) {
            throw new ContainerFormatException(describe(path) + " is a scalar");
        }
        return dims[0];
    }

    @Override
    public double[] readDoubles(String path) {
        Dataset ds = dataset(path);
        if (ds.isCompound()) {
            throw new ContainerFormatException(describe(path) + " is a compound dataset");
        }
        return NumericArrays.toDoubles(read(ds, path), describe(path));
    }

    @Override
    public double[] readField(String path, String field) {
        Dataset ds = dataset(path);
        if (!ds.isCompound()) {
            throw new ContainerFormatException(describe(path) + " is not a compound dataset");
        }
        Object data = read(ds, path);
        if (!(data instanceof Map<?, ?> columns) || !columns.containsKey(field)) {
            throw new ContainerFormatException(describe(path) + " has no member '" + field + "'");
        }
        return NumericArrays.toDoubles(columns.get(field), describe(path) + "." + field);
    }

    @Override
    public void close() {
        file.close();
    }

    private Dataset dataset(String path) {
        try {
            Node node = file.getByPath(path);
            if (node instanceof Dataset ds) {
                return ds;
            }
            throw new ContainerFormatException(describe(path) + " is not a dataset");
        } catch (HdfException e) {
            throw new ContainerFormatException("Missing dataset " + describe(path), e);
        }
    }

    private Object read(Dataset ds, String path) {
        try {
            return ds.getData();
        } catch (HdfException e) {
            throw new ContainerFormatException("Failed to read " + describe(path), e);
        }
    }

    private String describe(String path) {
        return filename + ":" + path;
    }
}
