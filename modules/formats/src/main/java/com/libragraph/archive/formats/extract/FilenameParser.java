package com.libragraph.archive.formats.extract;

import java.util.Map;

/**
 * Derives metadata fields from a name alone. For file extractors the name is the
 * leaf filename; for acquisition extractors it is the acquisition name.
 * <p>
 * Must be pure: no I/O, no state.
 */
@FunctionalInterface
public interface FilenameParser {

    /**
     * @return fields derived from {@code name}; may be empty
     * @throws ExtractionException if {@code name} does not follow this type's convention
     */
    Map<String, Object> parseFilename(String name) throws ExtractionException;
}
