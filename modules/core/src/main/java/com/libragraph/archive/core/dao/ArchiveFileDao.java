package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(ArchiveFileRecord.class)
public interface ArchiveFileDao {

    @SqlQuery("SELECT * FROM archive_file WHERE acq_id = :acqId AND name = :name")
    Optional<ArchiveFileRecord> find(@Bind("acqId") long acqId, @Bind("name") String name);

    @SqlUpdate("INSERT INTO archive_file (acq_id, name, type_id) VALUES (:acqId, :name, :typeId)")
    @GetGeneratedKeys("id")
    long insert(@Bind("acqId") long acqId, @Bind("name") String name, @Bind("typeId") int typeId);
}
