package com.libragraph.archive.core.ingest;

import com.libragraph.archive.core.classify.Classification;

/**
 * Result of import detection. On a match all three parts are set; on no match all are null.
 */
public record Detection(String acqName, Classification classification, PostImportCallback callback) {

    private static final Detection NO_MATCH = new Detection(null, null, null);

    public static Detection noMatch() {
        return NO_MATCH;
    }

    public boolean matched() {
        return acqName != null;
    }
}
