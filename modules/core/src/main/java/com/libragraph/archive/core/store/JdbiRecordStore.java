package com.libragraph.archive.core.store;

import com.libragraph.archive.core.dao.AcquisitionDao;
import com.libragraph.archive.core.dao.AcquisitionRecord;
import com.libragraph.archive.core.dao.ArchiveFileDao;
import com.libragraph.archive.core.dao.ArchiveFileRecord;
import com.libragraph.archive.core.dao.CopyRequestDao;
import com.libragraph.archive.core.dao.FileCopyDao;
import com.libragraph.archive.core.dao.FileCopyRecord;
import com.libragraph.archive.formats.extract.InfoRecord;
import com.libragraph.archive.types.CopyFlag;
import com.libragraph.archive.types.InfoTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.jdbi.v3.core.statement.Update;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link RecordStore} over the archive tables with Jdbi.
 *
 * <p>Get-or-create looks the row up, inserts it if missing, and on a unique-key
 * violation (another importer got there first) re-reads the existing row.
 */
@ApplicationScoped
public class JdbiRecordStore implements RecordStore {

    private static final Logger log = Logger.getLogger(JdbiRecordStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    @Inject
    Jdbi jdbi;

    public JdbiRecordStore() {
    }

    public JdbiRecordStore(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public GetOrCreate<AcquisitionRecord> getOrCreateAcquisition(String name, int acqTypeId, int instrumentId) {
        return getOrCreate(
                () -> jdbi.withExtension(AcquisitionDao.class, dao -> dao.findByName(name)),
                () -> jdbi.withExtension(AcquisitionDao.class, dao -> dao.insert(name, acqTypeId, instrumentId)),
                "acquisition " + name);
    }

    @Override
    public GetOrCreate<ArchiveFileRecord> getOrCreateFile(long acqId, String name, int fileTypeId) {
        return getOrCreate(
                () -> jdbi.withExtension(ArchiveFileDao.class, dao -> dao.find(acqId, name)),
                () -> jdbi.withExtension(ArchiveFileDao.class, dao -> dao.insert(acqId, name, fileTypeId)),
                "file " + name + " in acquisition " + acqId);
    }

    private static <T> GetOrCreate<T> getOrCreate(Supplier<Optional<T>> find, Runnable insert, String what) {
        Optional<T> existing = find.get();
        if (existing.isPresent()) {
            return GetOrCreate.found(existing.get());
        }
        try {
            insert.run();
        } catch (UnableToExecuteStatementException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            log.debugf("Lost insert race for %s; re-reading", what);
            return GetOrCreate.found(find.get()
                    .orElseThrow(() -> new IllegalStateException("Row for " + what + " vanished after conflict", e)));
        }
        T created = find.get()
                .orElseThrow(() -> new IllegalStateException("Row for " + what + " missing after insert"));
        log.debugf("Created %s", what);
        return GetOrCreate.created(created);
    }

    static boolean isUniqueViolation(UnableToExecuteStatementException e) {
        return e.getCause() instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState());
    }

    @Override
    public FileCopyRecord recordCopy(long fileId, long nodeId) {
        return jdbi.inTransaction(h -> {
            FileCopyDao dao = h.attach(FileCopyDao.class);
            Optional<FileCopyRecord> existing = dao.find(fileId, nodeId);
            if (existing.isPresent()) {
                dao.setFlags(existing.get().id(), CopyFlag.YES, CopyFlag.YES);
                return dao.findById(existing.get().id()).orElseThrow();
            }
            long id = dao.insertPresent(fileId, nodeId);
            return dao.findById(id).orElseThrow();
        });
    }

    @Override
    public boolean insertInfo(InfoRecord record) {
        Optional<InfoTable> table = record.table();
        if (table.isEmpty()) {
            return false;
        }
        String ownerColumn = table.get().owner().ownerColumn();
        List<String> columns = new ArrayList<>();
        columns.add(ownerColumn);
        for (Map.Entry<String, Object> e : record.values().entrySet()) {
            if (e.getValue() != null) {
                columns.add(e.getKey());
            }
        }
        String sql = "INSERT INTO " + table.get().tableName()
                + " (" + String.join(", ", columns) + ") VALUES (:"
                + String.join(", :", columns) + ")";

        try {
            jdbi.useHandle(h -> {
                Update update = h.createUpdate(sql).bind(ownerColumn, record.ownerId());
                for (Map.Entry<String, Object> e : record.values().entrySet()) {
                    if (e.getValue() != null) {
                        update.bindByType(e.getKey(), e.getValue(), e.getValue().getClass());
                    }
                }
                update.execute();
            });
        } catch (UnableToExecuteStatementException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            log.warnf("%s already has a record for owner %d; keeping the existing one",
                    table.get().tableName(), record.ownerId());
            return false;
        }
        log.debugf("Inserted %s for owner %d", table.get().tableName(), record.ownerId());
        return true;
    }

    @Override
    public Optional<Map<String, Object>> findInfo(InfoTable table, long ownerId) {
        String sql = "SELECT * FROM " + table.tableName() + " WHERE " + table.owner().ownerColumn() + " = :owner";
        return jdbi.withHandle(h -> h.createQuery(sql).bind("owner", ownerId).mapToMap().findOne());
    }

    @Override
    public void markCopyWanted(long copyId) {
        jdbi.useExtension(FileCopyDao.class, dao -> dao.setWantsFile(copyId, CopyFlag.YES));
    }

    @Override
    public void markCopyRemoved(long copyId) {
        jdbi.useExtension(FileCopyDao.class, dao -> dao.setFlags(copyId, CopyFlag.NO, CopyFlag.NO));
    }

    @Override
    public void cancelRequest(long requestId) {
        jdbi.useExtension(CopyRequestDao.class, dao -> dao.cancel(requestId));
    }

    @Override
    public void completeRequest(long requestId) {
        jdbi.useExtension(CopyRequestDao.class, dao -> dao.complete(requestId));
    }
}
