package com.libragraph.archive.core.ingest;

import com.libragraph.archive.core.classify.Classification;
import com.libragraph.archive.core.dao.AcquisitionRecord;
import com.libragraph.archive.core.dao.ArchiveFileRecord;
import com.libragraph.archive.core.dao.FileCopyRecord;
import com.libragraph.archive.core.storage.NodeIO;
import com.libragraph.archive.core.store.GetOrCreate;
import com.libragraph.archive.core.store.RecordStore;
import com.libragraph.archive.formats.extract.ExtractionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Imports one node-relative path: detection, acquisition and file get-or-create,
 * copy registration, then metadata for whatever this import created.
 *
 * <p>Never throws for a bad item; the failure comes back as {@link ImportOutcome.Failed}.
 */
@ApplicationScoped
public class ImportOrchestrator {

    private static final Logger log = Logger.getLogger(ImportOrchestrator.class);

    private final ImportDetector detector;
    private final RecordStore store;

    @Inject
    public ImportOrchestrator(ImportDetector detector, RecordStore store) {
        this.detector = detector;
        this.store = store;
    }

    public ImportOutcome importPath(String path, NodeIO node) {
        try {
            Detection detection = detector.detect(path, node);
            if (!detection.matched()) {
                log.debugf("Not importing %s: no match", path);
                return ImportOutcome.noMatch(path);
            }
            Classification c = detection.classification();

            GetOrCreate<AcquisitionRecord> acq = store.getOrCreateAcquisition(
                    detection.acqName(), c.acqType().id(), c.instrument().id());
            GetOrCreate<ArchiveFileRecord> file = store.getOrCreateFile(
                    acq.record().id(), c.fileName(), c.fileType().id());
            FileCopyRecord copy = store.recordCopy(file.record().id(), node.node().id());

            detection.callback().onImport(copy,
                    file.created() ? file.record() : null,
                    acq.created() ? acq.record() : null,
                    node);

            log.infof("Imported %s on %s (new acq: %s, new file: %s)",
                    path, node.node().name(), acq.created(), file.created());
            return new ImportOutcome.Imported(path, acq.record().id(), file.record().id(),
                    acq.created(), file.created());
        } catch (ExtractionException e) {
            log.errorf("Metadata extraction failed for %s: %s", path, e.getMessage());
            return ImportOutcome.fail(path, e);
        } catch (RuntimeException e) {
            log.errorf(e, "Import failed for %s", path);
            return ImportOutcome.fail(path, e);
        }
    }
}
