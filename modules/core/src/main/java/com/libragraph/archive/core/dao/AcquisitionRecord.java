package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record AcquisitionRecord(
        @ColumnName("id") long id,
        @ColumnName("name") String name,
        @ColumnName("type_id") Integer typeId,
        @ColumnName("inst_id") Integer instId
) {}
