package com.libragraph.archive.core.storage;

/**
 * A copy of an archive file on a node, as handed to {@link NodeIO#delete}.
 *
 * @param path node-relative path, {@code <acquisition>/<file>}
 */
public record FileCopy(long copyId, long fileId, String path) {}
