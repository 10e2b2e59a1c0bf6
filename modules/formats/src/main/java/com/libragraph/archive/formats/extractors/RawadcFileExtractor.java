package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.container.DataContainer;
import com.libragraph.archive.formats.extract.ContentParser;
import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.FilenameParser;
import com.libragraph.archive.util.Stats;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Raw ADC snapshot file {@code NNNNNN.h5}. Snapshots are not stored in time
 * order, so the span is the min/max of the timestamp table.
 */
public class RawadcFileExtractor implements FilenameParser, ContentParser {

    private static final Pattern NAME = Pattern.compile("^[0-9]{6}\\.h5$");
    static final String TIMESTAMP = "/timestamp";

    @Override
    public Map<String, Object> parseFilename(String name) throws ExtractionException {
        if (!NAME.matcher(name).matches()) {
            throw new ExtractionException("Bad raw ADC file name: " + name);
        }
        return Map.of();
    }

    @Override
    public Map<String, Object> parseContent(DataContainer container) throws ExtractionException {
        double[] ctime = container.readField(TIMESTAMP, "ctime");
        if (ctime.length == 0) {
            throw new ExtractionException("Empty timestamp table");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("start_time", Stats.min(ctime));
        fields.put("finish_time", Stats.max(ctime));
        return fields;
    }
}
