package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(InstrumentRecord.class)
public interface InstrumentDao {

    @SqlQuery("SELECT * FROM archive_inst ORDER BY id")
    List<InstrumentRecord> findAll();

    @SqlUpdate("UPDATE archive_inst SET notes = :notes WHERE name = :name")
    int updateByName(@Bind("name") String name, @Bind("notes") String notes);

    @SqlUpdate("INSERT INTO archive_inst (id, name, notes) VALUES (:id, :name, :notes)")
    void insert(@Bind("id") int id, @Bind("name") String name, @Bind("notes") String notes);
}
