package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(AllowedFileTypeRecord.class)
public interface AllowedFileTypeDao {

    /** Pairs ordered so each acquisition type's file types come out in registration order. */
    @SqlQuery("SELECT * FROM acq_file_types ORDER BY acq_type_id, file_type_id")
    List<AllowedFileTypeRecord> findAll();

    @SqlQuery("SELECT count(*) FROM acq_file_types " +
            "WHERE acq_type_id = :acqTypeId AND file_type_id = :fileTypeId")
    int count(@Bind("acqTypeId") int acqTypeId, @Bind("fileTypeId") int fileTypeId);

    @SqlUpdate("INSERT INTO acq_file_types (acq_type_id, file_type_id) VALUES (:acqTypeId, :fileTypeId)")
    void insert(@Bind("acqTypeId") int acqTypeId, @Bind("fileTypeId") int fileTypeId);

    /** Removes every pairing of {@code acqTypeId} with a file type not in {@code keep}. */
    @SqlUpdate("DELETE FROM acq_file_types WHERE acq_type_id = :acqTypeId AND file_type_id NOT IN (<keep>)")
    int deleteOthers(@Bind("acqTypeId") int acqTypeId, @BindList("keep") List<Integer> keep);
}
