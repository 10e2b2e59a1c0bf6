package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(AcqTypeRecord.class)
public interface AcqTypeDao {

    @SqlQuery("SELECT * FROM acq_type ORDER BY id")
    List<AcqTypeRecord> findAll();

    @SqlQuery("SELECT * FROM acq_type WHERE name = :name")
    Optional<AcqTypeRecord> findByName(@Bind("name") String name);

    /** Updates the row with the same name; returns the number of rows touched. */
    @SqlUpdate("UPDATE acq_type SET info_class = :infoClass, notes = :notes, priority = :priority " +
            "WHERE name = :name")
    int updateByName(@BindMethods AcqTypeRecord type);

    @SqlUpdate("INSERT INTO acq_type (id, name, info_class, notes, priority) " +
            "VALUES (:id, :name, :infoClass, :notes, :priority)")
    void insert(@BindMethods AcqTypeRecord type);
}
