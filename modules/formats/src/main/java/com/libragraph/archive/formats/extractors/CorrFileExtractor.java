package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.container.DataContainer;
import com.libragraph.archive.formats.extract.ContentParser;
import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.FilenameParser;

import java.util.LinkedHashMap;
import java.util.Map;

/** Correlator data file {@code CCCCCCCC_FFFF.h5}. */
public class CorrFileExtractor implements FilenameParser, ContentParser {

    private static final ChunkFileName NAME = new ChunkFileName("");

    @Override
    public Map<String, Object> parseFilename(String name) throws ExtractionException {
        return NAME.parse(name);
    }

    @Override
    public Map<String, Object> parseContent(DataContainer container) throws ExtractionException {
        Map<String, Object> fields = new LinkedHashMap<>();
        IndexMaps.putSpan(fields, IndexMaps.ctime(container), "time index");
        return fields;
    }
}
