package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.FilenameParser;
import com.libragraph.archive.util.AcqTimestamp;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Daily weather file {@code YYYYMMDD.h5}, covering that UTC day. */
public class WeatherFileExtractor implements FilenameParser {

    private static final Pattern NAME = Pattern.compile("^((?:19|20)[0-9]{6})\\.h5$");

    @Override
    public Map<String, Object> parseFilename(String name) throws ExtractionException {
        Matcher m = NAME.matcher(name);
        if (!m.matches()) {
            throw new ExtractionException("Bad weather file name: " + name);
        }
        String text = m.group(1);
        LocalDate date;
        try {
            date = AcqTimestamp.parseDate(text);
        } catch (DateTimeParseException e) {
            throw new ExtractionException("Bad date in weather file name: " + name, e);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("date", text);
        fields.put("start_time", (double) AcqTimestamp.startOfDay(date));
        fields.put("finish_time", (double) AcqTimestamp.endOfDay(date));
        return fields;
    }
}
