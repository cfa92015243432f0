package com.libragraph.atomizer;

import com.libragraph.atomizer.core.dispatch.NodeOutcome;
import com.libragraph.atomizer.core.ingest.IngestionOrchestrator;
import com.libragraph.atomizer.core.ingest.IngestionResult;
import com.libragraph.atomizer.core.store.InMemoryAtomStore;
import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.buffer.BinaryData;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end ingestion through the CDI-wired orchestrator, registry and default store.
 */
@QuarkusTest
class IngestionTest {

    @Inject
    IngestionOrchestrator orchestrator;

    @Inject
    InMemoryAtomStore store;

    private static byte[] zip(String... namesAndContents) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bytes)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                ZipEntry entry = new ZipEntry(namesAndContents[i]);
                entry.setTime(1704067200000L); // 2024-01-01 00:00:00 UTC
                zos.putNextEntry(entry);
                zos.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                zos.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    @Test
    void ingestZip_atomizesEveryEntry() throws IOException {
        byte[] zip = zip(
                "README.md", "# Project\n\nSome intro text.\n",
                "config.yaml", "name: demo\nport: 8080\n",
                "src/Main.java", "import java.util.List;\n\nclass Main {\n}\n",
                "notes.txt", "Plain notes. Two sentences.");

        IngestionResult result = orchestrator.ingest(zip, SourceMetadata.of("project.zip", "application/zip", zip.length));

        assertThat(result.hasFailures()).isFalse();
        assertThat(result.nodes())
                .filteredOn(NodeOutcome.Succeeded.class::isInstance)
                .map(n -> ((NodeOutcome.Succeeded) n).atomizer())
                .containsExactly("ArchiveAtomizer", "MarkdownAtomizer", "YamlAtomizer", "CodeAtomizer", "TextAtomizer");
        assertThat(result.atoms()).allSatisfy(atom -> assertThat(atom.size()).isLessThanOrEqualTo(Atom.MAX_SIZE));
        assertThat(result.atoms()).extracting(Atom::subtype)
                .contains(Subtypes.HEADING, Subtypes.FIELD, Subtypes.IMPORT, Subtypes.CLASS, Subtypes.SENTENCE);

        for (Atom atom : result.atoms()) {
            assertThat(store.find(atom.contentHash())).isPresent();
        }
        assertThat(store.componentsOf(result.rootHash())).extracting(AtomComposition::sequenceIndex)
                .containsExactly(0, 1, 2, 3);
    }

    @Test
    void ingestTwice_countsReferences() {
        byte[] text = "Repeated ingestion of the same text.".getBytes(StandardCharsets.UTF_8);
        SourceMetadata source = SourceMetadata.of("repeat.txt", "text/plain", text.length);

        IngestionResult first = orchestrator.ingest(text, source);
        long before = store.referenceCount(first.rootHash());
        IngestionResult second = orchestrator.ingest(text, source);

        assertThat(second.rootHash()).isEqualTo(first.rootHash());
        assertThat(store.referenceCount(first.rootHash())).isEqualTo(before + 1);
        assertThat(store.reconstruct(first.rootHash())).isEqualTo(text);
    }

    @Test
    void submit_runsOnIngestExecutor() throws Exception {
        byte[] json = "{\"a\":[1,2,3]}".getBytes(StandardCharsets.UTF_8);

        IngestionResult result = orchestrator.submit(BinaryData.of(json),
                        SourceMetadata.of("data.json", "application/json", json.length), CancellationToken.NONE)
                .get(30, TimeUnit.SECONDS);

        assertThat(result.nodes()).singleElement()
                .isInstanceOfSatisfying(NodeOutcome.Succeeded.class,
                        ok -> assertThat(ok.atomizer()).isEqualTo("JsonAtomizer"));
    }
}
