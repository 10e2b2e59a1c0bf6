package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(FileReservationRecord.class)
public interface FileReservationDao {

    /** Reservations of a file on a node, oldest first. */
    @SqlQuery("SELECT id, file_id, node_id, name FROM file_reservation " +
            "WHERE file_id = :fileId AND node_id = :nodeId ORDER BY id")
    List<FileReservationRecord> findForFileOnNode(@Bind("fileId") long fileId, @Bind("nodeId") long nodeId);

    @SqlUpdate("INSERT INTO file_reservation (file_id, node_id, name) VALUES (:fileId, :nodeId, :name)")
    @GetGeneratedKeys("id")
    long insert(@Bind("fileId") long fileId, @Bind("nodeId") long nodeId, @Bind("name") String name);

    @SqlUpdate("DELETE FROM file_reservation WHERE file_id = :fileId AND node_id = :nodeId AND name = :name")
    int release(@Bind("fileId") long fileId, @Bind("nodeId") long nodeId, @Bind("name") String name);
}
