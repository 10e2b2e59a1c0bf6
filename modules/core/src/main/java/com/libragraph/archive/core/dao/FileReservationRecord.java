package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record FileReservationRecord(
        @ColumnName("id") long id,
        @ColumnName("file_id") long fileId,
        @ColumnName("node_id") long nodeId,
        @ColumnName("name") String name
) {}
