package com.libragraph.archive.core.store;

import com.libragraph.archive.core.dao.AcquisitionRecord;
import com.libragraph.archive.core.dao.ArchiveFileRecord;
import com.libragraph.archive.core.dao.FileCopyRecord;
import com.libragraph.archive.formats.extract.InfoRecord;
import com.libragraph.archive.types.InfoTable;

import java.util.Map;
import java.util.Optional;

/**
 * Persistence for archive items, their copies and their metadata records.
 *
 * <p>Get-or-create calls are safe to race: a caller that loses the insert gets
 * the winner's row back with {@code created == false}.
 */
public interface RecordStore {

    GetOrCreate<AcquisitionRecord> getOrCreateAcquisition(String name, int acqTypeId, int instrumentId);

    GetOrCreate<ArchiveFileRecord> getOrCreateFile(long acqId, String name, int fileTypeId);

    /**
     * Marks the file as present on the node, creating the copy row if needed.
     */
    FileCopyRecord recordCopy(long fileId, long nodeId);

    /**
     * Writes a metadata record. Records without a table are ignored.
     *
     * @return false if the owner already had a record, which is left untouched
     */
    boolean insertInfo(InfoRecord record);

    Optional<Map<String, Object>> findInfo(InfoTable table, long ownerId);

    /** Flags a copy as wanted again, so it is re-fetched rather than removed. */
    void markCopyWanted(long copyId);

    /** Flags a copy as no longer present and no longer wanted. */
    void markCopyRemoved(long copyId);

    void cancelRequest(long requestId);

    void completeRequest(long requestId);
}
