package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record CopyRequestRecord(
        @ColumnName("id") long id,
        @ColumnName("file_id") long fileId,
        @ColumnName("node_from_id") long nodeFromId,
        @ColumnName("node_to_id") long nodeToId,
        @ColumnName("completed") boolean completed,
        @ColumnName("cancelled") boolean cancelled
) {}
