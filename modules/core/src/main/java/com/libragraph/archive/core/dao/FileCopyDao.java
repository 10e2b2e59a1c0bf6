package com.libragraph.archive.core.dao;

import com.libragraph.archive.types.CopyFlag;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

/**
 * Copies of archive files on storage nodes. {@code has_file} and
 * {@code wants_file} hold {@link CopyFlag} letters.
 */
@RegisterConstructorMapper(FileCopyRecord.class)
public interface FileCopyDao {

    @SqlQuery("SELECT * FROM archive_file_copy WHERE file_id = :fileId AND node_id = :nodeId")
    Optional<FileCopyRecord> find(@Bind("fileId") long fileId, @Bind("nodeId") long nodeId);

    @SqlQuery("SELECT * FROM archive_file_copy WHERE id = :id")
    Optional<FileCopyRecord> findById(@Bind("id") long id);

    @SqlUpdate("INSERT INTO archive_file_copy (file_id, node_id, has_file, wants_file) " +
            "VALUES (:fileId, :nodeId, 'Y', 'Y')")
    @GetGeneratedKeys("id")
    long insertPresent(@Bind("fileId") long fileId, @Bind("nodeId") long nodeId);

    @SqlUpdate("UPDATE archive_file_copy SET has_file = :hasFile, wants_file = :wantsFile, " +
            "last_update = CURRENT_TIMESTAMP WHERE id = :id")
    int setFlags(@Bind("id") long id, @Bind("hasFile") CopyFlag hasFile, @Bind("wantsFile") CopyFlag wantsFile);

    @SqlUpdate("UPDATE archive_file_copy SET wants_file = :wantsFile, last_update = CURRENT_TIMESTAMP " +
            "WHERE id = :id")
    int setWantsFile(@Bind("id") long id, @Bind("wantsFile") CopyFlag wantsFile);
}
