package com.libragraph.atomizer.core.ingest;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class IngestionConfig {

    @ConfigProperty(name = "atomizer.ingest.max-depth", defaultValue = "10")
    int maxDepth;

    @ConfigProperty(name = "atomizer.ingest.max-total-bytes", defaultValue = "1073741824")
    long maxTotalBytes;

    @ConfigProperty(name = "atomizer.ingest.worker-count", defaultValue = "4")
    int workerCount;

    public IngestionLimits limits() {
        return new IngestionLimits(maxDepth, maxTotalBytes);
    }

    public int workerCount() {
        return workerCount;
    }
}
