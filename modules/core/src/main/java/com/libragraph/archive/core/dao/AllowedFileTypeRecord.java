package com.libragraph.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record AllowedFileTypeRecord(
        @ColumnName("acq_type_id") int acqTypeId,
        @ColumnName("file_type_id") int fileTypeId
) {}
