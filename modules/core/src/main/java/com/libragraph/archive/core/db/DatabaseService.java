package com.libragraph.archive.core.db;

import com.libragraph.archive.core.dao.DatabaseDao;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.sql.SQLException;

/**
 * Verifies database connectivity at boot and answers liveness pings.
 */
@ApplicationScoped
@Startup
public class DatabaseService {

    private static final Logger log = Logger.getLogger(DatabaseService.class);

    @Inject
    Jdbi jdbi;

    private String serverVersion;

    @PostConstruct
    void init() {
        try {
            serverVersion = jdbi.withHandle(h -> {
                var meta = h.getConnection().getMetaData();
                return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
            });
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot read database metadata", e);
        }
        log.infof("Connected to: %s", serverVersion);
    }

    /** Executes SELECT 1; false if the database cannot be reached. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            log.warnf("Database ping failed: %s", e.getMessage());
            return false;
        }
    }

    /** Server product and version string read at startup. */
    public String serverVersion() {
        return serverVersion;
    }
}
