package com.libragraph.archive.formats.extract;

import com.libragraph.archive.formats.container.DataContainer;

import java.util.Map;

/**
 * Derives metadata fields from an opened data container.
 * The container is owned by the caller; implementations must not close it.
 */
@FunctionalInterface
public interface ContentParser {

    Map<String, Object> parseContent(DataContainer container) throws ExtractionException;
}
