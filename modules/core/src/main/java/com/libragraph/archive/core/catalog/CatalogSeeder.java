package com.libragraph.archive.core.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.archive.core.dao.AcqTypeDao;
import com.libragraph.archive.core.dao.AcqTypeRecord;
import com.libragraph.archive.core.dao.AllowedFileTypeDao;
import com.libragraph.archive.core.dao.FileTypeDao;
import com.libragraph.archive.core.dao.FileTypeRecord;
import com.libragraph.archive.core.dao.InstrumentDao;
import com.libragraph.archive.formats.extract.ExtractorRef;
import com.libragraph.archive.types.CatalogLookupException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts the built-in type catalog into the database.
 *
 * <p>Rows are matched by name and updated in place, or inserted with the seed
 * id. For every acquisition type named in the allowed pairs, pairings not in the
 * seed are removed. Types and instruments missing from the seed are left alone.
 */
@ApplicationScoped
public class CatalogSeeder {

    private static final Logger log = Logger.getLogger(CatalogSeeder.class);

    public static final String SEED_RESOURCE = "catalog-seed.json";

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    public CatalogSeeder() {
    }

    public CatalogSeeder(Jdbi jdbi, ObjectMapper objectMapper) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
    }

    public CatalogSeed readSeed() {
        try (InputStream in = CatalogSeeder.class.getClassLoader().getResourceAsStream(SEED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SEED_RESOURCE);
            }
            return objectMapper.readValue(in, CatalogSeed.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SEED_RESOURCE, e);
        }
    }

    public void seed() {
        seed(readSeed());
    }

    /**
     * Applies {@code seed} in one transaction.
     *
     * @throws CatalogLookupException if an extractor reference or allowed pair names something unknown
     * @throws IllegalArgumentException if a file pattern does not compile
     */
    public void seed(CatalogSeed seed) {
        validate(seed);
        jdbi.useTransaction(h -> {
            int[] acq = upsertAcqTypes(h, seed.acqTypes());
            int[] files = upsertFileTypes(h, seed.fileTypes());
            int pairs = replaceAllowedPairs(h, seed.allowedFileTypes());
            int inst = upsertInstruments(h, seed.instruments());
            log.infof("Catalog seeded: acq types %d updated/%d inserted, file types %d updated/%d inserted, "
                    + "%d pairs added, %d instruments inserted", acq[0], acq[1], files[0], files[1], pairs, inst);
        });
    }

    // Fail before touching the database.
    private static void validate(CatalogSeed seed) {
        for (CatalogSeed.AcqTypeEntry t : seed.acqTypes()) {
            if (t.infoClass() != null) ExtractorRef.parse(t.infoClass());
        }
        for (CatalogSeed.FileTypeEntry t : seed.fileTypes()) {
            if (t.infoClass() != null) ExtractorRef.parse(t.infoClass());
            if (t.pattern() != null) FilePattern.compile(t.pattern());
        }
    }

    private static int[] upsertAcqTypes(Handle h, List<CatalogSeed.AcqTypeEntry> entries) {
        AcqTypeDao dao = h.attach(AcqTypeDao.class);
        int updated = 0;
        int inserted = 0;
        for (CatalogSeed.AcqTypeEntry e : entries) {
            var row = new AcqTypeRecord(e.id(), e.name(), e.infoClass(), e.notes(), e.priority());
            if (dao.updateByName(row) == 0) {
                dao.insert(row);
                inserted++;
            } else {
                updated++;
            }
        }
        return new int[]{updated, inserted};
    }

    private static int[] upsertFileTypes(Handle h, List<CatalogSeed.FileTypeEntry> entries) {
        FileTypeDao dao = h.attach(FileTypeDao.class);
        int updated = 0;
        int inserted = 0;
        for (CatalogSeed.FileTypeEntry e : entries) {
            var row = new FileTypeRecord(e.id(), e.name(), e.infoClass(), e.pattern(), e.notes(), e.priority());
            if (dao.updateByName(row) == 0) {
                dao.insert(row);
                inserted++;
            } else {
                updated++;
            }
        }
        return new int[]{updated, inserted};
    }

    private static int replaceAllowedPairs(Handle h, List<CatalogSeed.AllowedPair> pairs) {
        AcqTypeDao acqDao = h.attach(AcqTypeDao.class);
        FileTypeDao fileDao = h.attach(FileTypeDao.class);
        AllowedFileTypeDao pairDao = h.attach(AllowedFileTypeDao.class);

        Map<Integer, List<Integer>> wanted = new LinkedHashMap<>();
        for (CatalogSeed.AllowedPair p : pairs) {
            int acqId = acqDao.findByName(p.acqType())
                    .orElseThrow(() -> new CatalogLookupException("Unknown acquisition type: " + p.acqType()))
                    .id();
            int fileId = fileDao.findByName(p.fileType())
                    .orElseThrow(() -> new CatalogLookupException("Unknown file type: " + p.fileType()))
                    .id();
            wanted.computeIfAbsent(acqId, k -> new ArrayList<>()).add(fileId);
        }

        int added = 0;
        for (Map.Entry<Integer, List<Integer>> e : wanted.entrySet()) {
            int removed = pairDao.deleteOthers(e.getKey(), e.getValue());
            if (removed > 0) {
                log.infof("Removed %d stale file type pairing(s) for acq type %d", removed, e.getKey());
            }
            for (int fileId : e.getValue()) {
                if (pairDao.count(e.getKey(), fileId) == 0) {
                    pairDao.insert(e.getKey(), fileId);
                    added++;
                }
            }
        }
        return added;
    }

    private static int upsertInstruments(Handle h, List<CatalogSeed.InstrumentEntry> entries) {
        InstrumentDao dao = h.attach(InstrumentDao.class);
        int inserted = 0;
        for (CatalogSeed.InstrumentEntry e : entries) {
            if (dao.updateByName(e.name(), e.notes()) == 0) {
                dao.insert(e.id(), e.name(), e.notes());
                inserted++;
            }
        }
        return inserted;
    }
}
