package com.libragraph.archive.formats.extract;

import com.libragraph.archive.types.Column;
import com.libragraph.archive.types.ExtractorId;
import com.libragraph.archive.types.InfoTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A fully built metadata record, ready for the record store.
 * Values are typed by the target table's columns; fields the table does not
 * declare have been dropped.
 */
public record InfoRecord(
        ExtractorId extractor,
        long ownerId,
        Map<String, Object> values
) {
    public InfoRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Coerces {@code fields} against the extractor's table.
     *
     * @throws ExtractionException if a value cannot be converted to its column type
     */
    public static InfoRecord build(ExtractorId extractor, long ownerId, Map<String, Object> fields)
            throws ExtractionException {
        Map<String, Object> values = new LinkedHashMap<>();
        Optional<InfoTable> table = extractor.table();
        if (table.isPresent()) {
            for (Column column : table.get().columns()) {
                if (!fields.containsKey(column.name())) {
                    continue;
                }
                try {
                    values.put(column.name(), column.type().coerce(fields.get(column.name())));
                } catch (IllegalArgumentException e) {
                    throw new ExtractionException("Bad value for " + table.get().tableName() + "."
                            + column.name() + ": " + fields.get(column.name()), e);
                }
            }
        }
        return new InfoRecord(extractor, ownerId, values);
    }

    public Optional<InfoTable> table() {
        return extractor.table();
    }

    /** Whether this record has a table to be written to. */
    public boolean isPersistent() {
        return extractor.table().isPresent();
    }
}
