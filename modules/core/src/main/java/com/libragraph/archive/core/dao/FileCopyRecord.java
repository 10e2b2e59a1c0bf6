package com.libragraph.archive.core.dao;

import com.libragraph.archive.types.CopyFlag;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record FileCopyRecord(
        @ColumnName("id") long id,
        @ColumnName("file_id") long fileId,
        @ColumnName("node_id") long nodeId,
        @ColumnName("has_file") CopyFlag hasFile,
        @ColumnName("wants_file") CopyFlag wantsFile,
        @ColumnName("last_update") Instant lastUpdate
) {}
