package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record StorageNodeRecord(
        @ColumnName("id") long id,
        @ColumnName("name") String name,
        @ColumnName("root") String root,
        @ColumnName("reserving") boolean reserving
) {}
