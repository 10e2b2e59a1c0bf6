package com.libragraph.archive.core.storage;

/**
 * A file operation on a storage node failed. Carries the node name and the
 * node-relative path so a failed delete or pull can be traced to its copy row.
 */
public class StorageException extends RuntimeException {

    private final String node;
    private final String path;

    public StorageException(String node, String path, String message) {
        this(node, path, message, null);
    }

    public StorageException(String node, String path, String message, Throwable cause) {
        super(message + " [" + node + ":" + path + "]", cause);
        this.node = node;
        this.path = path;
    }

    public String node() {
        return node;
    }

    public String path() {
        return path;
    }
}
