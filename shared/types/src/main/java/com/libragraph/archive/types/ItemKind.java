package com.libragraph.archive.types;

/**
 * The two kinds of archive item that carry a type and a metadata record.
 */
public enum ItemKind {
    ACQUISITION("acq_id"),
    FILE("file_id");

    private final String ownerColumn;

    ItemKind(String ownerColumn) {
        this.ownerColumn = ownerColumn;
    }

    /** Name of the foreign-key column that points an info row at its owner. */
    public String ownerColumn() {
        return ownerColumn;
    }
}
