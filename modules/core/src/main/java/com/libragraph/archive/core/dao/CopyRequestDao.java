package com.libragraph.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(CopyRequestRecord.class)
public interface CopyRequestDao {

    @SqlQuery("SELECT id, file_id, node_from_id, node_to_id, completed, cancelled " +
            "FROM archive_file_copy_request WHERE id = :id")
    Optional<CopyRequestRecord> findById(@Bind("id") long id);

    @SqlUpdate("INSERT INTO archive_file_copy_request (file_id, node_from_id, node_to_id) " +
            "VALUES (:fileId, :nodeFromId, :nodeToId)")
    @GetGeneratedKeys("id")
    long insert(@Bind("fileId") long fileId, @Bind("nodeFromId") long nodeFromId,
                @Bind("nodeToId") long nodeToId);

    @SqlUpdate("UPDATE archive_file_copy_request SET cancelled = TRUE, last_update = CURRENT_TIMESTAMP " +
            "WHERE id = :id")
    int cancel(@Bind("id") long id);

    @SqlUpdate("UPDATE archive_file_copy_request SET completed = TRUE, last_update = CURRENT_TIMESTAMP " +
            "WHERE id = :id")
    int complete(@Bind("id") long id);
}
