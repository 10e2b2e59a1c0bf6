package com.libragraph.archive.core.reserve;

import com.libragraph.archive.core.dao.FileReservationDao;
import com.libragraph.archive.core.dao.FileReservationRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class JdbiReservationGuard implements ReservationGuard {

    @Inject
    Jdbi jdbi;

    public JdbiReservationGuard() {
    }

    public JdbiReservationGuard(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public Optional<String> reservation(long fileId, long nodeId) {
        List<FileReservationRecord> found = jdbi.withExtension(FileReservationDao.class,
                dao -> dao.findForFileOnNode(fileId, nodeId));
        return found.stream().findFirst().map(FileReservationRecord::name);
    }
}
