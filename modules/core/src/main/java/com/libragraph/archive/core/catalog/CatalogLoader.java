package com.libragraph.archive.core.catalog;

import com.libragraph.archive.core.dao.AcqTypeDao;
import com.libragraph.archive.core.dao.AcqTypeRecord;
import com.libragraph.archive.core.dao.AllowedFileTypeDao;
import com.libragraph.archive.core.dao.AllowedFileTypeRecord;
import com.libragraph.archive.core.dao.FileTypeDao;
import com.libragraph.archive.core.dao.FileTypeRecord;
import com.libragraph.archive.core.dao.InstrumentDao;
import com.libragraph.archive.core.dao.InstrumentRecord;
import com.libragraph.archive.formats.extract.ExtractorRef;
import com.libragraph.archive.formats.extract.ExtractorRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds a {@link TypeCatalog} from the catalog tables. Types register in id
 * order, which is the order classification tries file patterns in.
 */
@ApplicationScoped
public class CatalogLoader {

    private static final Logger log = Logger.getLogger(CatalogLoader.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ExtractorRegistry extractors;

    public CatalogLoader() {
    }

    public CatalogLoader(Jdbi jdbi, ExtractorRegistry extractors) {
        this.jdbi = jdbi;
        this.extractors = extractors;
    }

    public TypeCatalog load() {
        TypeCatalog catalog = new TypeCatalog(extractors);
        jdbi.useHandle(h -> {
            Map<Integer, String> acqNames = new HashMap<>();
            for (AcqTypeRecord r : h.attach(AcqTypeDao.class).findAll()) {
                catalog.registerOrUpdate(new AcqType(r.id(), r.name(), ref(r.infoClass()), r.notes(), r.priority()));
                acqNames.put(r.id(), r.name());
            }

            Map<Integer, String> fileNames = new HashMap<>();
            for (FileTypeRecord r : h.attach(FileTypeDao.class).findAll()) {
                FilePattern pattern = r.pattern() == null ? null : FilePattern.compile(r.pattern());
                catalog.registerOrUpdate(new FileType(r.id(), r.name(), ref(r.infoClass()), pattern,
                        r.notes(), r.priority()));
                fileNames.put(r.id(), r.name());
            }

            for (AllowedFileTypeRecord r : h.attach(AllowedFileTypeDao.class).findAll()) {
                catalog.allow(acqNames.get(r.acqTypeId()), fileNames.get(r.fileTypeId()));
            }

            for (InstrumentRecord r : h.attach(InstrumentDao.class).findAll()) {
                catalog.registerOrUpdate(new Instrument(r.id(), r.name(), r.notes()));
            }
        });
        log.infof("Loaded type catalog: %d acquisition types, %d file types, %d instruments",
                catalog.acqTypes().size(), catalog.fileTypes().size(), catalog.instruments().size());
        return catalog;
    }

    private static ExtractorRef ref(String infoClass) {
        return infoClass == null ? null : ExtractorRef.parse(infoClass);
    }
}
