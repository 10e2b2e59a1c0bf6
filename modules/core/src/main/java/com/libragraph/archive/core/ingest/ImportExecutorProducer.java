package com.libragraph.archive.core.ingest;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class ImportExecutorProducer {

    @ConfigProperty(name = "archive.import.workers", defaultValue = "4")
    int workerCount;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("importExecutor")
    public ExecutorService importExecutor() {
        AtomicInteger n = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "import-worker-" + n.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        executor = Executors.newFixedThreadPool(workerCount, threads);
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
