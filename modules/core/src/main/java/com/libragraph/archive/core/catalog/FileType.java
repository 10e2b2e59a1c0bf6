package com.libragraph.archive.core.catalog;

import com.libragraph.archive.formats.extract.ExtractorRef;

import java.util.Objects;
import java.util.Optional;

/**
 * A file type within an acquisition.
 *
 * @param extractorRef null if files of this type carry no metadata
 * @param pattern      null if the type is never matched on import
 */
public record FileType(
        int id,
        String name,
        ExtractorRef extractorRef,
        FilePattern pattern,
        String notes,
        int priority
) {
    public FileType {
        Objects.requireNonNull(name, "name");
    }

    public Optional<ExtractorRef> extractor() {
        return Optional.ofNullable(extractorRef);
    }

    public Optional<FilePattern> filePattern() {
        return Optional.ofNullable(pattern);
    }
}
