package com.libragraph.archive.formats.extract;

/**
 * A name or file did not have the shape expected by an extractor, or its
 * content could not be read. Aborts the metadata record for that one item.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
