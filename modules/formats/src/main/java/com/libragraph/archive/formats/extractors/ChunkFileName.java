package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.extract.ExtractionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses {@code <prefix>CCCCCCCC_FFFF.h5} chunk file names into chunk and frequency numbers. */
final class ChunkFileName {

    private final Pattern pattern;

    ChunkFileName(String prefix) {
        this.pattern = Pattern.compile("^" + Pattern.quote(prefix) + "([0-9]{8})_([0-9]{4})\\.h5$");
    }

    Map<String, Object> parse(String name) throws ExtractionException {
        Matcher m = pattern.matcher(name);
        if (!m.matches()) {
            throw new ExtractionException("Bad chunk file name: " + name);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("chunk_number", Integer.parseInt(m.group(1)));
        fields.put("freq_number", Integer.parseInt(m.group(2)));
        return fields;
    }
}
