package com.libragraph.atomizer.core.ingest;

import com.libragraph.atomizer.core.dispatch.AtomizationDispatcher;
import com.libragraph.atomizer.core.store.InMemoryAtomStore;
import com.libragraph.atomizer.core.test.TestZipBuilder;
import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.atomizers.archive.ArchiveAtomizer;
import com.libragraph.atomizer.formats.atomizers.binary.BinaryAtomizer;
import com.libragraph.atomizer.formats.atomizers.structured.JsonAtomizer;
import com.libragraph.atomizer.formats.atomizers.text.TextAtomizer;
import com.libragraph.atomizer.formats.registry.AtomizerRegistry;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.buffer.BinaryData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class IngestionOrchestratorTest {

    private ExecutorService executor;
    private InMemoryAtomStore store;
    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        store = new InMemoryAtomStore();
        AtomizerRegistry registry = new AtomizerRegistry(List.of(
                new ArchiveAtomizer(), new TextAtomizer(), new JsonAtomizer(), new BinaryAtomizer()));
        orchestrator = new IngestionOrchestrator(
                new AtomizationDispatcher(registry, IngestionLimits.defaults()), store, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static SourceMetadata zipSource(byte[] zip) {
        return SourceMetadata.of("bundle.zip", "application/zip", zip.length);
    }

    @Test
    void shouldStoreAggregatedAtomsAndCompositions() {
        byte[] zip = new TestZipBuilder()
                .addFile("a.txt", "Shared sentence. Only in a.")
                .addFile("b.txt", "Shared sentence. Only in b.")
                .buildBytes();

        IngestionResult result = orchestrator.ingest(zip, zipSource(zip));

        assertThat(result.hasFailures()).isFalse();
        assertThat(result.stats().nodes()).isEqualTo(3);
        assertThat(result.atoms()).extracting(Atom::contentHash).doesNotHaveDuplicates();
        assertThat(result.stats().uniqueAtoms()).isEqualTo(result.atoms().size());
        assertThat(result.stats().totalAtoms()).isGreaterThan(result.stats().uniqueAtoms());
        assertThat(store.atomCount()).isEqualTo(result.atoms().size());
        assertThat(store.compositionCount()).isEqualTo(result.compositions().size());

        Set<String> keys = new HashSet<>();
        for (AtomComposition c : result.compositions()) {
            assertThat(keys.add(c.parentAtomHash().toHex() + "#" + c.sequenceIndex())).isTrue();
        }
        assertThat(store.componentsOf(result.rootHash())).hasSize(2);
    }

    @Test
    void shouldReconstructTextEntriesFromStore() {
        String text = "First sentence here. Second one follows!";
        byte[] zip = new TestZipBuilder().addFile("doc.txt", text).buildBytes();

        IngestionResult result = orchestrator.ingest(zip, zipSource(zip));

        Atom docRoot = store.componentsOf(result.rootHash()).stream()
                .map(c -> store.find(c.componentAtomHash()).orElseThrow())
                .findFirst().orElseThrow();
        assertThat(docRoot.subtype()).isEqualTo(Subtypes.FILE_METADATA);
        assertThat(store.reconstruct(docRoot.contentHash())).isEqualTo(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldPrefixWarningsAndFailuresWithNodePath() {
        byte[] zip = new TestZipBuilder()
                .addFile("ok.txt", "Fine.")
                .addFile("bad.json", "[1, 2")
                .buildBytes();

        IngestionResult result = orchestrator.ingest(zip, zipSource(zip));

        assertThat(result.hasFailures()).isTrue();
        assertThat(result.failures()).singleElement().asString().startsWith("bundle.zip!/bad.json: STRUCTURAL: ");
        assertThat(result.stats().failedNodes()).isEqualTo(1);
    }

    @Test
    void shouldStoreNothingWhenCancelled() {
        byte[] zip = new TestZipBuilder().addFile("a.txt", "Text.").buildBytes();
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> orchestrator.ingest(BinaryData.of(zip), zipSource(zip), token))
                .isInstanceOf(CancellationException.class);
        assertThat(store.atomCount()).isZero();
        assertThat(store.compositionCount()).isZero();
    }

    @Test
    void shouldIngestOnWorkerPool() throws Exception {
        byte[] text = "Asynchronous ingestion works.".getBytes(StandardCharsets.UTF_8);

        IngestionResult result = orchestrator.submit(BinaryData.of(text),
                SourceMetadata.of("async.txt", "text/plain", text.length), CancellationToken.NONE)
                .get(10, TimeUnit.SECONDS);

        assertThat(result.nodes()).hasSize(1);
        assertThat(store.reconstruct(result.rootHash())).isEqualTo(text);
    }

    @Test
    void shouldSurfaceRootFailureFromWorkerPool() {
        byte[] notJson = "{oops".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> orchestrator.submit(BinaryData.of(notJson),
                SourceMetadata.of("bad.json", "application/json", notJson.length), CancellationToken.NONE)
                .get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(StructuralParseException.class);
    }
}
