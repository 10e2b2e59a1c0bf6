package com.libragraph.archive.core.test;

import com.libragraph.archive.core.dao.AcquisitionRecord;
import com.libragraph.archive.core.dao.ArchiveFileRecord;
import com.libragraph.archive.core.dao.FileCopyRecord;
import com.libragraph.archive.core.store.GetOrCreate;
import com.libragraph.archive.core.store.RecordStore;
import com.libragraph.archive.formats.extract.InfoRecord;
import com.libragraph.archive.types.CopyFlag;
import com.libragraph.archive.types.InfoTable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/** Thread-safe {@link RecordStore} double that keeps everything in maps. */
public class InMemoryRecordStore implements RecordStore {

    private final AtomicLong ids = new AtomicLong();
    private final Map<String, AcquisitionRecord> acqs = new HashMap<>();
    private final Map<String, ArchiveFileRecord> files = new HashMap<>();
    private final Map<Long, FileCopyRecord> copies = new LinkedHashMap<>();
    private final Map<InfoTable, Map<Long, Map<String, Object>>> info = new HashMap<>();

    public final List<Long> cancelledRequests = new ArrayList<>();
    public final List<Long> completedRequests = new ArrayList<>();

    @Override
    public synchronized GetOrCreate<AcquisitionRecord> getOrCreateAcquisition(String name, int acqTypeId,
                                                                              int instrumentId) {
        AcquisitionRecord existing = acqs.get(name);
        if (existing != null) {
            return GetOrCreate.found(existing);
        }
        var created = new AcquisitionRecord(ids.incrementAndGet(), name, acqTypeId, instrumentId);
        acqs.put(name, created);
        return GetOrCreate.created(created);
    }

    @Override
    public synchronized GetOrCreate<ArchiveFileRecord> getOrCreateFile(long acqId, String name, int fileTypeId) {
        String key = acqId + "/" + name;
        ArchiveFileRecord existing = files.get(key);
        if (existing != null) {
            return GetOrCreate.found(existing);
        }
        var created = new ArchiveFileRecord(ids.incrementAndGet(), acqId, name, fileTypeId);
        files.put(key, created);
        return GetOrCreate.created(created);
    }

    @Override
    public synchronized FileCopyRecord recordCopy(long fileId, long nodeId) {
        for (FileCopyRecord c : copies.values()) {
            if (c.fileId() == fileId && c.nodeId() == nodeId) {
                var updated = new FileCopyRecord(c.id(), fileId, nodeId, CopyFlag.YES, CopyFlag.YES, Instant.now());
                copies.put(c.id(), updated);
                return updated;
            }
        }
        var created = new FileCopyRecord(ids.incrementAndGet(), fileId, nodeId, CopyFlag.YES, CopyFlag.YES, Instant.now());
        copies.put(created.id(), created);
        return created;
    }

    /** Adds a copy row directly, as the daemon would have when the file arrived. */
    public synchronized FileCopyRecord addCopy(long fileId, long nodeId, CopyFlag hasFile, CopyFlag wantsFile) {
        var created = new FileCopyRecord(ids.incrementAndGet(), fileId, nodeId, hasFile, wantsFile, Instant.now());
        copies.put(created.id(), created);
        return created;
    }

    @Override
    public synchronized boolean insertInfo(InfoRecord record) {
        if (record.table().isEmpty()) {
            return false;
        }
        Map<Long, Map<String, Object>> rows = info.computeIfAbsent(record.table().get(), t -> new HashMap<>());
        if (rows.containsKey(record.ownerId())) {
            return false;
        }
        rows.put(record.ownerId(), new HashMap<>(record.values()));
        return true;
    }

    @Override
    public synchronized Optional<Map<String, Object>> findInfo(InfoTable table, long ownerId) {
        return Optional.ofNullable(info.getOrDefault(table, Map.of()).get(ownerId));
    }

    public synchronized int infoCount(InfoTable table) {
        return info.getOrDefault(table, Map.of()).size();
    }

    public synchronized int acquisitionCount() {
        return acqs.size();
    }

    public synchronized int fileCount() {
        return files.size();
    }

    public synchronized Optional<FileCopyRecord> copy(long copyId) {
        return Optional.ofNullable(copies.get(copyId));
    }

    @Override
    public synchronized void markCopyWanted(long copyId) {
        FileCopyRecord c = copies.get(copyId);
        copies.put(copyId, new FileCopyRecord(c.id(), c.fileId(), c.nodeId(), c.hasFile(), CopyFlag.YES, Instant.now()));
    }

    @Override
    public synchronized void markCopyRemoved(long copyId) {
        FileCopyRecord c = copies.get(copyId);
        copies.put(copyId, new FileCopyRecord(c.id(), c.fileId(), c.nodeId(), CopyFlag.NO, CopyFlag.NO, Instant.now()));
    }

    @Override
    public synchronized void cancelRequest(long requestId) {
        cancelledRequests.add(requestId);
    }

    @Override
    public synchronized void completeRequest(long requestId) {
        completedRequests.add(requestId);
    }
}
