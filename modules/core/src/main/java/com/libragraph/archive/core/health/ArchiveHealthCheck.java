package com.libragraph.archive.core.health;

import com.libragraph.archive.core.catalog.TypeCatalog;
import com.libragraph.archive.core.db.DatabaseService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready when the database answers and the type catalog has something to classify with.
 */
@Readiness
@ApplicationScoped
public class ArchiveHealthCheck implements HealthCheck {

    @Inject
    DatabaseService database;

    @Inject
    TypeCatalog catalog;

    @Override
    public HealthCheckResponse call() {
        boolean dbUp = database.ping();
        int acqTypes = catalog.acqTypes().size();
        int fileTypes = catalog.fileTypes().size();
        return HealthCheckResponse.named("archive")
                .status(dbUp && acqTypes > 0)
                .withData("database", dbUp ? database.serverVersion() : "unreachable")
                .withData("acqTypes", acqTypes)
                .withData("fileTypes", fileTypes)
                .withData("instruments", catalog.instruments().size())
                .build();
    }
}
