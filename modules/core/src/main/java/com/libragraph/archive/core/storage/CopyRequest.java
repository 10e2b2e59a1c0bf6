package com.libragraph.archive.core.storage;

import com.libragraph.archive.core.dao.StorageNodeRecord;

/**
 * A request to copy a file from {@code source} onto the node handling it.
 *
 * @param path node-relative path, identical on both nodes
 */
public record CopyRequest(long requestId, long fileId, String path, StorageNodeRecord source) {}
