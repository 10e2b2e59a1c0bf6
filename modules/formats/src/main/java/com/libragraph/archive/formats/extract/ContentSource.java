package com.libragraph.archive.formats.extract;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens the bytes of the item being extracted. Supplied by the storage node so
 * extractors never see a raw filesystem path.
 */
@FunctionalInterface
public interface ContentSource {

    InputStream open() throws IOException;
}
