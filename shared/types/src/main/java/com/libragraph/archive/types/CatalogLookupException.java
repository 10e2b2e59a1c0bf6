package com.libragraph.archive.types;

/**
 * Thrown when a type, instrument or extractor cannot be found in the catalog,
 * or an indirect extractor reference cannot be resolved for its owner.
 */
public class CatalogLookupException extends RuntimeException {

    public CatalogLookupException(String message) {
        super(message);
    }
}
