package com.libragraph.archive.core.ingest;

import com.libragraph.archive.core.storage.NodeIO;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Imports many paths on the import worker pool. Outcomes come back in input order.
 */
@ApplicationScoped
public class ImportBatchRunner {

    private static final Logger log = Logger.getLogger(ImportBatchRunner.class);

    private final ImportOrchestrator orchestrator;
    private final ExecutorService executor;

    @Inject
    public ImportBatchRunner(ImportOrchestrator orchestrator, @Named("importExecutor") ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.executor = executor;
    }

    /**
     * @throws InterruptedException if interrupted while waiting; imports already
     *                              submitted keep running
     */
    public List<ImportOutcome> importAll(List<String> paths, NodeIO node) throws InterruptedException {
        List<Future<ImportOutcome>> futures = new ArrayList<>(paths.size());
        for (String path : paths) {
            futures.add(executor.submit(() -> orchestrator.importPath(path, node)));
        }

        List<ImportOutcome> outcomes = new ArrayList<>(paths.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                outcomes.add(ImportOutcome.fail(paths.get(i), e.getCause()));
            }
        }

        long imported = outcomes.stream().filter(o -> o instanceof ImportOutcome.Imported).count();
        long failed = outcomes.stream().filter(o -> o instanceof ImportOutcome.Failed).count();
        log.infof("Batch on %s: %d paths, %d imported, %d failed, %d not matched",
                node.node().name(), paths.size(), imported, failed, paths.size() - imported - failed);
        return outcomes;
    }
}
