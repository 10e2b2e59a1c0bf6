package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record ArchiveFileRecord(
        @ColumnName("id") long id,
        @ColumnName("acq_id") long acqId,
        @ColumnName("name") String name,
        @ColumnName("type_id") Integer typeId
) {}
