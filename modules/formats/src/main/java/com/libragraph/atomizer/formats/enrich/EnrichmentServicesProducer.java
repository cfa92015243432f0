package com.libragraph.atomizer.formats.enrich;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Collects whichever enrichment beans the application provides; absent ones stay absent.
 */
@ApplicationScoped
public class EnrichmentServicesProducer {

    private static final Logger log = Logger.getLogger(EnrichmentServicesProducer.class);

    @Inject
    Instance<OcrService> ocr;

    @Inject
    Instance<ObjectDetectionService> objectDetection;

    @Inject
    Instance<SceneAnalysisService> sceneAnalysis;

    @Inject
    Instance<FrameExtractor> frameExtractor;

    @ConfigProperty(name = "atomizer.enrichment.timeout-ms", defaultValue = "30000")
    long timeoutMs;

    private EnrichmentServices services;

    @Produces
    @Singleton
    public EnrichmentServices enrichmentServices() {
        services = new EnrichmentServices(
                resolve(ocr), resolve(objectDetection), resolve(sceneAnalysis), resolve(frameExtractor),
                Duration.ofMillis(timeoutMs));
        log.infof("Enrichment: ocr=%s objectDetection=%s sceneAnalysis=%s frameExtractor=%s",
                services.ocr().isPresent(), services.objectDetection().isPresent(),
                services.sceneAnalysis().isPresent(), services.frameExtractor().isPresent());
        return services;
    }

    @PreDestroy
    void shutdown() {
        if (services != null) services.close();
    }

    private static <T> T resolve(Instance<T> instance) {
        return instance.isResolvable() ? instance.get() : null;
    }
}
