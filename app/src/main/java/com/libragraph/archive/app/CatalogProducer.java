package com.libragraph.archive.app;

import com.libragraph.archive.core.catalog.CatalogLoader;
import com.libragraph.archive.core.catalog.CatalogSeeder;
import com.libragraph.archive.core.catalog.TypeCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Provides the type catalog: seeds the built-in types (unless disabled), then
 * loads whatever the catalog tables hold.
 */
@ApplicationScoped
public class CatalogProducer {

    private static final Logger log = Logger.getLogger(CatalogProducer.class);

    @Inject
    CatalogSeeder seeder;

    @Inject
    CatalogLoader loader;

    @ConfigProperty(name = "archive.catalog.seed-on-start", defaultValue = "true")
    boolean seedOnStart;

    @Produces
    @Singleton
    TypeCatalog typeCatalog() {
        if (seedOnStart) {
            seeder.seed();
        } else {
            log.info("Catalog seeding disabled; using existing catalog rows");
        }
        return loader.load();
    }
}
