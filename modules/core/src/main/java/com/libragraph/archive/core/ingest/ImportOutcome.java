package com.libragraph.archive.core.ingest;

public sealed interface ImportOutcome {

    String path();

    /**
     * The path was imported. The created flags say whether this import made
     * the acquisition and file rows, and so extracted their metadata.
     */
    record Imported(String path, long acqId, long fileId, boolean acqCreated, boolean fileCreated)
            implements ImportOutcome {}

    /** The path is not a recognised acquisition file; nothing was written. */
    record NoMatch(String path) implements ImportOutcome {}

    record Failed(String path, ImportError error) implements ImportOutcome {}

    static ImportOutcome noMatch(String path) {
        return new NoMatch(path);
    }

    static ImportOutcome fail(String path, Throwable t) {
        return new Failed(path, ImportError.from(t));
    }
}
