package com.libragraph.archive.formats.container;

import java.io.IOException;

/**
 * Read-only view of an opened scientific data container: a tree of named,
 * indexable arrays addressed by slash-separated paths such as
 * {@code /index_map/time}.
 * <p>
 * Implementations own the underlying handle and release it on {@link #close()}.
 */
public interface DataContainer extends AutoCloseable {

    /** Does a dataset exist at {@code path}? */
    boolean contains(String path);

    /**
     * Number of entries along the first axis of the dataset at {@code path}.
     *
     * @throws ContainerFormatException if there is no dataset at {@code path}
     */
    int length(String path);

    /**
     * Reads a one-dimensional numeric dataset as doubles.
     *
     * @throws ContainerFormatException if the dataset is missing or not numeric
     */
    double[] readDoubles(String path);

    /**
     * Reads one numeric member of a compound (record) dataset as doubles, e.g. the
     * {@code ctime} member of a {@code (fpga_count, ctime)} time index.
     *
     * @throws ContainerFormatException if the dataset or member is missing or not numeric
     */
    double[] readField(String path, String field);

    @Override
    void close() throws IOException;
}
