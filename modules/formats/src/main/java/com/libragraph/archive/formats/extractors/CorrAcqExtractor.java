package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.container.DataContainer;
import com.libragraph.archive.formats.extract.ContentParser;
import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.FilenameParser;

import java.util.LinkedHashMap;
import java.util.Map;

/** Correlator acquisition: cadence and axis sizes from the first data file. */
public class CorrAcqExtractor implements FilenameParser, ContentParser {

    @Override
    public Map<String, Object> parseFilename(String name) throws ExtractionException {
        AcqNameParser.acquisitionTime(name);
        return Map.of();
    }

    @Override
    public Map<String, Object> parseContent(DataContainer container) throws ExtractionException {
        Map<String, Object> fields = new LinkedHashMap<>();
        IndexMaps.integration(container).ifPresent(v -> fields.put("integration", v));
        fields.put("nfreq", container.length(IndexMaps.FREQ));
        fields.put("nprod", container.length(IndexMaps.PROD));
        return fields;
    }
}
