package com.libragraph.atomizer.core.ingest;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class IngestExecutorProducer {

    private static final Logger log = Logger.getLogger(IngestExecutorProducer.class);

    @Inject
    IngestionConfig config;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("ingestExecutor")
    public ExecutorService ingestExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "ingest-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        executor = Executors.newFixedThreadPool(config.workerCount(), factory);
        log.infof("Ingest executor started with %d workers", config.workerCount());
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
