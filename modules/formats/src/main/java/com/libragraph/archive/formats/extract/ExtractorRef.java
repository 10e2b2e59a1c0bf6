package com.libragraph.archive.formats.extract;

import com.libragraph.archive.types.CatalogLookupException;
import com.libragraph.archive.types.ExtractorId;
import com.libragraph.archive.types.ResolverId;

/**
 * The extractor binding of a type, parsed from its stored {@code info_class}
 * string. A leading {@link ResolverId#SIGIL} marks an indirect reference.
 */
public interface ExtractorRef {

    /** The stored form of this reference. */
    String reference();

    record Direct(ExtractorId extractor) implements ExtractorRef {
        @Override
        public String reference() {
            return extractor.label();
        }
    }

    record Indirect(ResolverId resolver) implements ExtractorRef {
        @Override
        public String reference() {
            return resolver.reference();
        }
    }

    /**
     * Parses a stored reference.
     *
     * @throws CatalogLookupException if the name is not a known extractor or resolver
     */
    static ExtractorRef parse(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new CatalogLookupException("Empty extractor reference");
        }
        if (reference.charAt(0) == ResolverId.SIGIL) {
            String label = reference.substring(1);
            return ResolverId.find(label)
                    .<ExtractorRef>map(Indirect::new)
                    .orElseThrow(() -> new CatalogLookupException("Unknown extractor resolver: " + label));
        }
        return ExtractorId.find(reference)
                .<ExtractorRef>map(Direct::new)
                .orElseThrow(() -> new CatalogLookupException("Unknown extractor: " + reference));
    }
}
