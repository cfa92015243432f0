package com.libragraph.atomizer.formats.atomizers.archive;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.ChildSource;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.codecs.GzipCodec;
import com.libragraph.atomizer.util.buffer.BinaryData;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static com.libragraph.atomizer.formats.AtomizerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ArchiveAtomizerTest {

    private final List<AtomizationResult> results = new ArrayList<>();

    @AfterEach
    void releaseEntries() throws IOException {
        for (AtomizationResult result : results) {
            for (ChildSource child : result.childSources()) {
                child.content().close();
            }
        }
    }

    private AtomizationResult run(ArchiveAtomizer atomizer, String name, byte[] bytes) {
        AtomizationResult result = atomize(atomizer, name, "application/octet-stream", bytes);
        results.add(result);
        return result;
    }

    private AtomizationResult runWithBudget(String name, byte[] bytes, long budget) {
        AtomizationResult result = new ArchiveAtomizer().atomize(BinaryData.of(bytes),
                SourceMetadata.of(name, "application/octet-stream", bytes.length), CancellationToken.NONE, budget);
        results.add(result);
        return result;
    }

    private static byte[] zeroEntries(int count, int entrySize) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        byte[] zeros = new byte[entrySize];
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (int i = 0; i < count; i++) {
                zip.putNextEntry(new ZipEntry("zeros-" + i + ".bin"));
                zip.write(zeros);
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static long materialized(AtomizationResult result) {
        return result.childSources().stream().mapToLong(c -> c.content().size()).sum();
    }

    private static byte[] zip(String... namesAndContents) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                ZipEntry entry = new ZipEntry(namesAndContents[i]);
                entry.setTime(0L);
                zip.putNextEntry(entry);
                if (namesAndContents[i + 1] != null) {
                    zip.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                }
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static byte[] tarGz(String... namesAndContents) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GZIPOutputStream(bytes))) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                byte[] data = namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8);
                TarArchiveEntry entry = new TarArchiveEntry(namesAndContents[i]);
                entry.setSize(data.length);
                tar.putArchiveEntry(entry);
                tar.write(data);
                tar.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(bytes)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return bytes.toByteArray();
    }

    @Test
    void shouldQueueZipEntriesAsChildSources() throws IOException {
        byte[] bytes = zip("docs/", null, "docs/readme.txt", "Read me first.", "data.json", "{\"a\":1}");

        AtomizationResult result = run(new ArchiveAtomizer(), "bundle.zip", bytes);

        assertWellFormed(result);
        assertThat(result.processingInfo().detectedFormat()).isEqualTo("application/zip");
        assertThat(result.atoms()).hasSize(1);
        assertThat(result.childSources()).extracting(ChildSource::entryIndex).containsExactly(0, 1);
        assertThat(result.childSources()).extracting(c -> c.source().fileName())
                .containsExactly("docs/readme.txt", "data.json");
        assertThat(result.childSources()).extracting(c -> c.source().contentType())
                .containsExactly("text/plain", "application/json");
        assertThat(result.childSources()).extracting(c -> c.position().path())
                .containsExactly("docs/readme.txt", "data.json");
        assertThat(result.childSources()).allSatisfy(c -> assertThat(c.parentAtomHash()).isEqualTo(result.rootHash()));
        assertThat(result.childSources().get(0).content().toByteArray())
                .isEqualTo("Read me first.".getBytes(StandardCharsets.UTF_8));
        assertThat(result.childSources().get(1).source().sourceUri()).isEqualTo("file:bundle.zip!/data.json");
        assertThat(result.rootAtom().metadata()).contains("\"entries\":2").contains("\"skipped\":0");
    }

    @Test
    void shouldAcceptEmptyZip() throws IOException {
        AtomizationResult result = run(new ArchiveAtomizer(), "empty.zip", zip());

        assertThat(result.childSources()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.rootAtom().metadata()).contains("\"entries\":0");
    }

    @Test
    void shouldSkipOversizedEntriesWithWarning() throws IOException {
        byte[] bytes = zip("small.txt", "tiny", "big.txt", "x".repeat(20));

        AtomizationResult result = run(new ArchiveAtomizer(List.of(new GzipCodec()), 10), "mixed.zip", bytes);

        assertThat(result.childSources()).extracting(c -> c.source().fileName()).containsExactly("small.txt");
        assertThat(result.warnings()).singleElement().asString()
                .contains("Skipped entry big.txt of mixed.zip")
                .contains("exceeds 10");
        assertThat(result.rootAtom().metadata()).contains("\"skipped\":1");
    }

    @Test
    void shouldWalkCompressedTar() throws IOException {
        byte[] bytes = tarGz("a.txt", "alpha", "dir/b.md", "# beta");

        AtomizationResult result = run(new ArchiveAtomizer(), "bundle.tar.gz", bytes);

        assertThat(result.processingInfo().detectedFormat()).isEqualTo("application/gzip+tar");
        assertThat(result.childSources()).extracting(c -> c.source().fileName()).containsExactly("a.txt", "dir/b.md");
        assertThat(result.childSources().get(1).content().toByteArray())
                .isEqualTo("# beta".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldDecodeSingleCompressedFile() throws IOException {
        AtomizationResult result = run(new ArchiveAtomizer(), "notes.txt.gz", gzip("Some notes."));

        assertThat(result.processingInfo().detectedFormat()).isEqualTo("application/gzip");
        assertThat(result.childSources()).singleElement().satisfies(child -> {
            assertThat(child.source().fileName()).isEqualTo("notes.txt");
            assertThat(child.content().toByteArray()).isEqualTo("Some notes.".getBytes(StandardCharsets.UTF_8));
        });
    }

    @Test
    void shouldRejectCorruptZip() {
        byte[] bytes = {'P', 'K', 3, 4, 1, 2, 3, 4, 5, 6, 7, 8, 9};

        assertThatThrownBy(() -> run(new ArchiveAtomizer(), "broken.zip", bytes))
                .isInstanceOf(StructuralParseException.class)
                .hasMessageContaining("broken.zip");
    }

    @Test
    void shouldRejectUnknownContainer() {
        byte[] bytes = "just some text".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> run(new ArchiveAtomizer(), "odd.zip", bytes))
                .isInstanceOf(StructuralParseException.class)
                .hasMessageContaining("Unrecognised archive format");
    }

    @Test
    void shouldStopDecompressingAtExpansionBudget() throws IOException {
        int mib = 1024 * 1024;
        byte[] bytes = zeroEntries(20, mib);

        AtomizationResult result = runWithBudget("bomb.zip", bytes, 3L * mib);

        assertThat(bytes.length).isLessThan(mib);
        assertThat(materialized(result)).isEqualTo(3L * mib);
        assertThat(result.childSources()).hasSize(20);
        assertThat(result.childSources()).extracting(ChildSource::entryIndex).startsWith(0, 1, 2, 3).endsWith(19);
        assertThat(result.childSources().subList(0, 3)).noneMatch(ChildSource::isRejected);
        assertThat(result.childSources().subList(3, 20)).allSatisfy(child -> {
            assertThat(child.isRejected()).isTrue();
            assertThat(child.content().size()).isZero();
            assertThat(child.rejection().limitName()).isEqualTo(ArchiveAtomizer.EXPANSION_LIMIT);
            assertThat(child.rejection().limit()).isEqualTo(3L * mib);
        });
        assertThat(result.rootAtom().metadata())
                .contains("\"rejected\":17")
                .contains("\"expandedBytes\":" + 3L * mib);
    }

    @Test
    void shouldRejectDecodedStreamOverBudget() throws IOException {
        AtomizationResult result = runWithBudget("log.txt.gz", gzip("line\n".repeat(1000)), 100);

        assertThat(result.childSources()).singleElement().satisfies(child -> {
            assertThat(child.source().fileName()).isEqualTo("log.txt");
            assertThat(child.isRejected()).isTrue();
            assertThat(child.rejection().observed()).isGreaterThan(100);
        });
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void shouldExpandFreelyWithoutBudget() throws IOException {
        AtomizationResult result = run(new ArchiveAtomizer(), "zeros.zip", zeroEntries(3, 1024));

        assertThat(materialized(result)).isEqualTo(3 * 1024);
        assertThat(result.childSources()).noneMatch(ChildSource::isRejected);
    }
}
