package com.libragraph.archive.core.catalog;

import java.util.List;

/**
 * The built-in catalog content, read from {@code catalog-seed.json}.
 * Types with a null {@code infoClass} and {@code pattern} are kept only
 * because existing rows reference them; they never match on import.
 */
public record CatalogSeed(
        List<AcqTypeEntry> acqTypes,
        List<FileTypeEntry> fileTypes,
        List<AllowedPair> allowedFileTypes,
        List<InstrumentEntry> instruments
) {
    public record AcqTypeEntry(int id, String name, String infoClass, String notes, int priority) {}

    public record FileTypeEntry(int id, String name, String infoClass, String pattern, String notes, int priority) {}

    public record AllowedPair(String acqType, String fileType) {}

    public record InstrumentEntry(int id, String name, String notes) {}
}
