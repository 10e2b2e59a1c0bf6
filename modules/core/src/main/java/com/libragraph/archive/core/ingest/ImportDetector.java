package com.libragraph.archive.core.ingest;

import com.libragraph.archive.core.catalog.TypeCatalog;
import com.libragraph.archive.core.classify.Classification;
import com.libragraph.archive.core.classify.PathClassifier;
import com.libragraph.archive.core.dao.AcquisitionRecord;
import com.libragraph.archive.core.dao.ArchiveFileRecord;
import com.libragraph.archive.core.dao.FileCopyRecord;
import com.libragraph.archive.core.storage.NodeIO;
import com.libragraph.archive.core.store.RecordStore;
import com.libragraph.archive.formats.extract.ExtractionContext;
import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.formats.extract.ExtractionService;
import com.libragraph.archive.formats.extract.Extractor;
import com.libragraph.archive.formats.extract.InfoRecord;
import com.libragraph.archive.formats.extract.OwningItem;
import com.libragraph.archive.types.ItemKind;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a path is importable and, if so, supplies the callback that
 * fills in metadata for newly created acquisitions and files.
 */
@ApplicationScoped
public class ImportDetector {

    private static final Logger log = Logger.getLogger(ImportDetector.class);

    private final PathClassifier classifier;
    private final TypeCatalog catalog;
    private final ExtractionService extraction;
    private final RecordStore store;

    @Inject
    public ImportDetector(PathClassifier classifier, TypeCatalog catalog,
                          ExtractionService extraction, RecordStore store) {
        this.classifier = classifier;
        this.catalog = catalog;
        this.extraction = extraction;
        this.store = store;
    }

    public Detection detect(String path, NodeIO node) {
        Optional<Classification> found = classifier.classify(path);
        if (found.isEmpty()) {
            return Detection.noMatch();
        }
        Classification c = found.get();
        log.debugf("%s on %s: acq type %s, file type %s", path, node.node().name(),
                c.acqType().name(), c.fileType().name());
        return new Detection(c.acqName().name(), c,
                (copy, newFile, newAcq, n) -> storeInfo(c, copy, newFile, newAcq, n));
    }

    private void storeInfo(Classification c, FileCopyRecord copy, ArchiveFileRecord newFile,
                           AcquisitionRecord newAcq, NodeIO node) throws ExtractionException {
        if (newAcq != null) {
            var owner = new OwningItem(ItemKind.ACQUISITION, newAcq.id(), newAcq.name(), c.acqType().name());
            Optional<Extractor> extractor = catalog.resolveExtractor(c.acqType(), owner);
            if (extractor.isPresent()) {
                // Only tables with a start_time column keep it
                Map<String, Object> external =
                        Map.of("start_time", (double) c.acqName().time().getEpochSecond());
                persist(extractor.get(), new ExtractionContext(newAcq.name(), c.path(),
                        () -> node.open(c.path()), newAcq.id(), external));
            }
        }

        if (newFile != null) {
            var owner = new OwningItem(ItemKind.FILE, newFile.id(), newFile.name(), c.acqType().name());
            Optional<Extractor> extractor = catalog.resolveExtractor(c.fileType(), owner);
            if (extractor.isPresent()) {
                Map<String, Object> external = new HashMap<>(c.groups());
                persist(extractor.get(), new ExtractionContext(newFile.name(), c.path(),
                        () -> node.open(c.path()), newFile.id(), external));
            }
        }
    }

    private void persist(Extractor extractor, ExtractionContext ctx) throws ExtractionException {
        InfoRecord record = extraction.extract(extractor, ctx);
        if (record.isPersistent()) {
            store.insertInfo(record);
            log.infof("Stored %s for %s", record.table().get().tableName(), ctx.name());
        }
    }
}
