package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.FilenameParser;

import java.util.Map;

/**
 * Raw ADC acquisition. The name is only validated; start_time is the
 * acquisition timestamp, supplied by the importer from the classification.
 */
public class RawadcAcqExtractor implements FilenameParser {

    @Override
    public Map<String, Object> parseFilename(String name) throws ExtractionException {
        AcqNameParser.acquisitionTime(name);
        return Map.of();
    }
}
