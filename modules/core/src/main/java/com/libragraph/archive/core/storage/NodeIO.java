package com.libragraph.archive.core.storage;

import com.libragraph.archive.core.dao.StorageNodeRecord;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * I/O against one storage node. All paths are relative to the node root.
 */
public interface NodeIO {

    StorageNodeRecord node();

    /**
     * Opens a file on this node for reading. The caller closes the stream.
     */
    InputStream open(String path) throws IOException;

    /**
     * Removes {@code copies} from this node and records them as gone.
     *
     * @throws StorageException if a file cannot be removed; copies before it are already gone
     */
    void delete(List<FileCopy> copies);

    /**
     * Fulfils {@code request} by copying the file from the source node onto this one.
     *
     * @throws StorageException if the copy fails; the request is left open
     */
    void pull(CopyRequest request);
}
