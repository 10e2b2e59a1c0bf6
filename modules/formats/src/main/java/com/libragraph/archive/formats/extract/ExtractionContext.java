package com.libragraph.archive.formats.extract;

import java.util.Map;
import java.util.Objects;

/**
 * Inputs to a single extraction.
 *
 * @param name     leaf filename, or the acquisition name for acquisition extractors
 * @param path     node-relative path of the file whose content is read (for messages)
 * @param source   opens the file content; only used if the extractor parses content
 * @param ownerId  id of the acquisition or file row the record will belong to
 * @param external fields supplied from upstream (pattern groups, acquisition time);
 *                 these win over filename- and content-derived fields
 */
public record ExtractionContext(
        String name,
        String path,
        ContentSource source,
        long ownerId,
        Map<String, Object> external
) {
    public ExtractionContext {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        external = external == null ? Map.of() : Map.copyOf(external);
    }
}
