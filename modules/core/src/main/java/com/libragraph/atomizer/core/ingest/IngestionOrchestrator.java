package com.libragraph.atomizer.core.ingest;

import com.libragraph.atomizer.core.dispatch.AtomizationDispatcher;
import com.libragraph.atomizer.core.dispatch.DispatchResult;
import com.libragraph.atomizer.core.dispatch.NodeOutcome;
import com.libragraph.atomizer.core.store.AtomSink;
import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for ingestion: dispatches the source tree, aggregates the per-node results and
 * hands atoms and compositions to the {@link AtomSink}. A cancelled ingestion stores nothing.
 */
@ApplicationScoped
public class IngestionOrchestrator {

    private static final Logger log = Logger.getLogger(IngestionOrchestrator.class);

    private final AtomizationDispatcher dispatcher;
    private final AtomSink sink;
    private final ExecutorService executor;

    @Inject
    public IngestionOrchestrator(AtomizationDispatcher dispatcher, AtomSink sink,
                                 @Named("ingestExecutor") ExecutorService executor) {
        this.dispatcher = dispatcher;
        this.sink = sink;
        this.executor = executor;
    }

    public IngestionResult ingest(byte[] content, SourceMetadata source) {
        return ingest(BinaryData.of(content), source, CancellationToken.NONE);
    }

    public IngestionResult ingest(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        long start = System.nanoTime();
        log.debugf("Ingesting %s (%d bytes, %s)", source.fileName(), content.size(), source.contentType());

        DispatchResult dispatched = dispatcher.dispatch(content, source, cancellation);
        cancellation.throwIfCancellationRequested();

        Map<ContentHash, Atom> atoms = new LinkedHashMap<>();
        List<AtomComposition> compositions = new ArrayList<>();
        Set<String> edgeKeys = new HashSet<>();
        List<String> warnings = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        long totalAtoms = 0;

        for (NodeOutcome node : dispatched.nodes()) {
            if (node instanceof NodeOutcome.Succeeded ok) {
                AtomizationResult result = ok.result();
                result.atoms().forEach(a -> atoms.putIfAbsent(a.contentHash(), a));
                result.compositions().forEach(c -> addEdge(c, compositions, edgeKeys));
                result.warnings().forEach(w -> warnings.add(node.path() + ": " + w));
                totalAtoms += result.processingInfo().totalAtoms();
            } else if (node instanceof NodeOutcome.Failed failed) {
                failures.add(node.path() + ": " + failed.failure().kind() + ": " + failed.failure().message());
            }
        }
        dispatched.links().forEach(c -> addEdge(c, compositions, edgeKeys));

        sink.upsertAtoms(atoms.values());
        sink.storeCompositions(compositions);

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        IngestionResult.Stats stats = new IngestionResult.Stats(dispatched.nodes().size(), failures.size(),
                totalAtoms, atoms.size(), compositions.size(), durationMs);
        log.infof("Ingested %s: %d nodes (%d failed), %d atoms (%d unique), %d compositions in %dms",
                source.fileName(), stats.nodes(), stats.failedNodes(), stats.totalAtoms(), stats.uniqueAtoms(),
                stats.compositions(), durationMs);

        return new IngestionResult(source, dispatched.root().result().rootHash(), dispatched.nodes(),
                new ArrayList<>(atoms.values()), compositions, warnings, failures, stats);
    }

    /**
     * Runs {@link #ingest(BinaryData, SourceMetadata, CancellationToken)} on the ingest worker pool.
     */
    public CompletableFuture<IngestionResult> submit(BinaryData content, SourceMetadata source,
                                                     CancellationToken cancellation) {
        return CompletableFuture.supplyAsync(() -> ingest(content, source, cancellation), executor);
    }

    // identical subtrees under different archives repeat their edges
    private static void addEdge(AtomComposition c, List<AtomComposition> compositions, Set<String> keys) {
        if (keys.add(c.parentAtomHash().toHex() + "#" + c.sequenceIndex())) {
            compositions.add(c);
        }
    }
}
