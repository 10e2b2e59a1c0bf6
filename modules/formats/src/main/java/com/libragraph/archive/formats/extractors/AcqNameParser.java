package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.FilenameParser;
import com.libragraph.archive.util.AcqTimestamp;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Validates an acquisition name of the form {@code TIMESTAMP_INST_ACQTYPE}.
 * Used on its own by the detect-only acquisition extractors, which persist nothing.
 */
public class AcqNameParser implements FilenameParser {

    @Override
    public Map<String, Object> parseFilename(String name) throws ExtractionException {
        acquisitionTime(name);
        return Map.of();
    }

    /**
     * Returns the timestamp part of a valid acquisition name.
     *
     * @throws ExtractionException if the name is not three non-empty parts or the
     *                             timestamp is not strict UTC basic format
     */
    public static Instant acquisitionTime(String name) throws ExtractionException {
        String[] parts = name.split("_", -1);
        if (parts.length != 3) {
            throw new ExtractionException("Bad acquisition name: " + name);
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new ExtractionException("Bad acquisition name: " + name);
            }
        }
        try {
            return AcqTimestamp.parse(parts[0]);
        } catch (DateTimeParseException e) {
            throw new ExtractionException("Bad timestamp in acquisition name: " + name, e);
        }
    }
}
