package com.libragraph.archive.core.catalog;

import com.libragraph.archive.formats.extract.ExtractorRef;

import java.util.Objects;
import java.util.Optional;

/**
 * An acquisition type. The name is the last part of an acquisition name.
 *
 * @param extractorRef null if acquisitions of this type carry no metadata
 */
public record AcqType(
        int id,
        String name,
        ExtractorRef extractorRef,
        String notes,
        int priority
) {
    public AcqType {
        Objects.requireNonNull(name, "name");
    }

    public Optional<ExtractorRef> extractor() {
        return Optional.ofNullable(extractorRef);
    }
}
