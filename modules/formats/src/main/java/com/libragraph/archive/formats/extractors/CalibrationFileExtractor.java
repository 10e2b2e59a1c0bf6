package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.container.DataContainer;
import com.libragraph.archive.formats.extract.ContentParser;
import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.FilenameParser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Calibration product file {@code NNNNNNNN.h5}. The digital gain, gain and
 * flag-input products share this layout and differ only in the table written.
 */
public class CalibrationFileExtractor implements FilenameParser, ContentParser {

    private static final Pattern NAME = Pattern.compile("^[0-9]{8}\\.h5$");

    @Override
    public Map<String, Object> parseFilename(String name) throws ExtractionException {
        if (!NAME.matcher(name).matches()) {
            throw new ExtractionException("Bad calibration file name: " + name);
        }
        return Map.of();
    }

    @Override
    public Map<String, Object> parseContent(DataContainer container) throws ExtractionException {
        Map<String, Object> fields = new LinkedHashMap<>();
        IndexMaps.putSpan(fields, container.readDoubles(IndexMaps.UPDATE_TIME), "update_time index");
        return fields;
    }
}
