package com.libragraph.atomizer.formats.enrich;

import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The optional enrichment collaborators available to atomizers, plus the call policy for them:
 * every call runs under a timeout and any failure becomes a warning instead of an exception.
 */
public final class EnrichmentServices implements AutoCloseable {

    private static final Logger log = Logger.getLogger(EnrichmentServices.class);
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final OcrService ocr;
    private final ObjectDetectionService objectDetection;
    private final SceneAnalysisService sceneAnalysis;
    private final FrameExtractor frameExtractor;
    private final Duration timeout;
    private final ExecutorService executor;

    public EnrichmentServices(OcrService ocr, ObjectDetectionService objectDetection,
                              SceneAnalysisService sceneAnalysis, FrameExtractor frameExtractor,
                              Duration timeout) {
        this.ocr = ocr;
        this.objectDetection = objectDetection;
        this.sceneAnalysis = sceneAnalysis;
        this.frameExtractor = frameExtractor;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "enrichment-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * No collaborators at all.
     */
    public static EnrichmentServices none() {
        return new EnrichmentServices(null, null, null, null, Duration.ofSeconds(30));
    }

    public Optional<OcrService> ocr() {
        return Optional.ofNullable(ocr);
    }

    public Optional<ObjectDetectionService> objectDetection() {
        return Optional.ofNullable(objectDetection);
    }

    public Optional<SceneAnalysisService> sceneAnalysis() {
        return Optional.ofNullable(sceneAnalysis);
    }

    public Optional<FrameExtractor> frameExtractor() {
        return Optional.ofNullable(frameExtractor);
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Runs one enrichment call. A failure, a timeout or a null answer records a warning on
     * {@code graph} and yields an empty Optional.
     *
     * @param capability name used in the warning, e.g. "OCR"
     */
    public <T> Optional<T> call(String capability, Callable<T> call, AtomGraph.Builder graph) {
        Future<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (Exception e) {
                throw new EnrichmentCallException(e);
            }
        }, executor);
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                graph.warn(capability + " returned no result");
            }
            return Optional.ofNullable(result);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warnf("%s timed out after %dms", capability, timeout.toMillis());
            graph.warn(capability + " timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof EnrichmentCallException wrapped ? wrapped.getCause() : e.getCause();
            log.warnf(cause, "%s failed", capability);
            graph.warn(capability + " failed: " + describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            graph.warn(capability + " interrupted");
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static final class EnrichmentCallException extends RuntimeException {
        EnrichmentCallException(Throwable cause) {
            super(cause);
        }
    }
}
