package com.libragraph.archive.formats.container;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens a {@link DataContainer} over a byte stream supplied by the storage node.
 * The opener does not close {@code input}; the caller owns it.
 */
@FunctionalInterface
public interface ContainerOpener {

    /**
     * @param input    read-only stream positioned at the start of the file
     * @param filename name of the file, for error messages
     * @throws IOException              if the stream cannot be read
     * @throws ContainerFormatException if the bytes are not a readable container
     */
    DataContainer open(InputStream input, String filename) throws IOException;
}
