package com.libragraph.archive.formats.extract;

import com.libragraph.archive.types.ExtractorId;

import java.util.Objects;
import java.util.Optional;

/**
 * A registered extractor: its id plus whichever capabilities it has.
 * Capabilities are fixed when the extractor is registered.
 */
public record Extractor(
        ExtractorId id,
        Optional<FilenameParser> filenameParser,
        Optional<ContentParser> contentParser
) {
    public Extractor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(filenameParser, "filenameParser");
        Objects.requireNonNull(contentParser, "contentParser");
    }

    /**
     * Builds an extractor from an implementation object, picking up each
     * capability interface it implements.
     */
    public static Extractor of(ExtractorId id, Object implementation) {
        return new Extractor(id,
                implementation instanceof FilenameParser fp ? Optional.of(fp) : Optional.empty(),
                implementation instanceof ContentParser cp ? Optional.of(cp) : Optional.empty());
    }

    /** An extractor with neither capability; produces an empty record. */
    public static Extractor empty(ExtractorId id) {
        return new Extractor(id, Optional.empty(), Optional.empty());
    }

    public boolean readsContent() {
        return contentParser.isPresent();
    }
}
