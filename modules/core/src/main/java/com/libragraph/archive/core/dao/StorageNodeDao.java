package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(StorageNodeRecord.class)
public interface StorageNodeDao {

    @SqlQuery("SELECT * FROM storage_node WHERE name = :name")
    Optional<StorageNodeRecord> findByName(@Bind("name") String name);

    @SqlQuery("SELECT * FROM storage_node WHERE id = :id")
    Optional<StorageNodeRecord> findById(@Bind("id") long id);

    @SqlUpdate("INSERT INTO storage_node (name, root, reserving) VALUES (:name, :root, :reserving)")
    @GetGeneratedKeys("id")
    long insert(@Bind("name") String name, @Bind("root") String root, @Bind("reserving") boolean reserving);

    @SqlUpdate("UPDATE storage_node SET root = :root, reserving = :reserving WHERE id = :id")
    void update(@Bind("id") long id, @Bind("root") String root, @Bind("reserving") boolean reserving);
}
