package com.libragraph.archive.core.reserve;

import com.libragraph.archive.core.dao.FileReservationDao;
import com.libragraph.archive.core.dao.StorageNodeRecord;
import com.libragraph.archive.core.store.JdbiRecordStore;
import com.libragraph.archive.core.test.TestCatalogs;
import com.libragraph.archive.core.test.TestDatabase;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JdbiReservationGuardTest {

    private Jdbi jdbi;
    private JdbiReservationGuard guard;
    private StorageNodeRecord node;
    private StorageNodeRecord other;
    private long fileId;

    @BeforeEach
    void setUp() {
        jdbi = TestDatabase.create();
        TestCatalogs.seeder(jdbi).seed();
        node = TestDatabase.createNode(jdbi, "cedar", "/data/cedar");
        other = TestDatabase.createNode(jdbi, "oak", "/data/oak");
        var store = new JdbiRecordStore(jdbi);
        long acqId = store.getOrCreateAcquisition("20220129T233553Z_chimetiming_corr", 1, 263).record().id();
        fileId = store.getOrCreateFile(acqId, "00000000_0000.h5", 1).record().id();
        guard = new JdbiReservationGuard(jdbi);
    }

    @Test
    void shouldReportNoReservation() {
        assertThat(guard.reservation(fileId, node.id())).isEmpty();
        assertThat(guard.isReserved(fileId, node.id())).isFalse();
    }

    @Test
    void shouldReportOldestReservationOnTheNode() {
        jdbi.useExtension(FileReservationDao.class, dao -> {
            dao.insert(fileId, node.id(), "analysis");
            dao.insert(fileId, node.id(), "backfill");
        });

        assertThat(guard.reservation(fileId, node.id())).contains("analysis");
        assertThat(guard.isReserved(fileId, other.id())).isFalse();
    }

    @Test
    void shouldForgetReleasedReservation() {
        jdbi.useExtension(FileReservationDao.class, dao -> dao.insert(fileId, node.id(), "analysis"));
        jdbi.useExtension(FileReservationDao.class, dao -> dao.release(fileId, node.id(), "analysis"));

        assertThat(guard.isReserved(fileId, node.id())).isFalse();
    }
}
