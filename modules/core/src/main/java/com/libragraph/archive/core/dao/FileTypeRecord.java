package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record FileTypeRecord(
        @ColumnName("id") int id,
        @ColumnName("name") String name,
        @ColumnName("info_class") String infoClass,
        @ColumnName("pattern") String pattern,
        @ColumnName("notes") String notes,
        @ColumnName("priority") int priority
) {}
