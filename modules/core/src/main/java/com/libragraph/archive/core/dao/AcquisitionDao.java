package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(AcquisitionRecord.class)
public interface AcquisitionDao {

    @SqlQuery("SELECT * FROM archive_acq WHERE name = :name")
    Optional<AcquisitionRecord> findByName(@Bind("name") String name);

    @SqlQuery("SELECT * FROM archive_acq WHERE id = :id")
    Optional<AcquisitionRecord> findById(@Bind("id") long id);

    @SqlUpdate("INSERT INTO archive_acq (name, type_id, inst_id) VALUES (:name, :typeId, :instId)")
    @GetGeneratedKeys("id")
    long insert(@Bind("name") String name, @Bind("typeId") int typeId, @Bind("instId") int instId);
}
