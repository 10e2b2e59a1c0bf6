package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(FileTypeRecord.class)
public interface FileTypeDao {

    @SqlQuery("SELECT * FROM file_type ORDER BY id")
    List<FileTypeRecord> findAll();

    @SqlQuery("SELECT * FROM file_type WHERE name = :name")
    Optional<FileTypeRecord> findByName(@Bind("name") String name);

    @SqlUpdate("UPDATE file_type SET info_class = :infoClass, pattern = :pattern, notes = :notes, " +
            "priority = :priority WHERE name = :name")
    int updateByName(@BindMethods FileTypeRecord type);

    @SqlUpdate("INSERT INTO file_type (id, name, info_class, pattern, notes, priority) " +
            "VALUES (:id, :name, :infoClass, :pattern, :notes, :priority)")
    void insert(@BindMethods FileTypeRecord type);
}
