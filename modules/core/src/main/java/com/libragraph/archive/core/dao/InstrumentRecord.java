package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record InstrumentRecord(
        @ColumnName("id") int id,
        @ColumnName("name") String name,
        @ColumnName("notes") String notes
) {}
