package com.libragraph.atomizer.formats.atomizers.archive;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.ChildSource;
import com.libragraph.atomizer.formats.api.Codec;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.ResourceLimitExceededException;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.codecs.BoundedCopy;
import com.libragraph.atomizer.formats.codecs.Bzip2Codec;
import com.libragraph.atomizer.formats.codecs.GzipCodec;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.formats.tika.ContentTypeDetector;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.util.buffer.BinaryData;
import com.libragraph.atomizer.util.buffer.Buffer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.StreamSupport;

/**
 * ZIP, TAR and single-stream compressed files. Emits no atoms of its own beyond the file-metadata
 * root: every regular entry becomes a {@link ChildSource} whose entry index is its sequence index
 * under the archive root. GZIP/BZIP2 payloads are decoded through {@link Codec}s; a decoded TAR
 * ({@code .tar.gz}, {@code .tgz}) is walked directly.
 *
 * <p>Directories and links are skipped. Entries over {@code atomizer.archive.max-entry-bytes}
 * are skipped with a warning. A corrupt container is a structural failure.
 *
 * <p>The expansion budget bounds the decompressed bytes of all entries together. Once an entry
 * would pass it, that entry and every later one come back as rejected children without being
 * decompressed.
 */
@ApplicationScoped
public class ArchiveAtomizer implements Atomizer {

    private static final Logger log = Logger.getLogger(ArchiveAtomizer.class);

    public static final long DEFAULT_MAX_ENTRY_BYTES = 100L * 1024 * 1024;
    public static final String EXPANSION_LIMIT = "archive expansion budget";

    static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};
    static final byte[] ZIP_EMPTY_MAGIC = {'P', 'K', 5, 6};
    static final byte[] TAR_MAGIC = {'u', 's', 't', 'a', 'r'};
    static final int TAR_MAGIC_OFFSET = 257;

    private static final DetectionCriteria CRITERIA = new DetectionCriteria(
            Set.of("application/zip", "application/java-archive", "application/x-tar", "application/gzip",
                    "application/x-gzip", "application/x-gtar", "application/x-compressed-tar", "application/x-bzip2"),
            Set.of("zip", "jar", "tar", "gz", "gzip", "tgz", "bz2", "bzip2", "tbz2"),
            ZIP_MAGIC, 0, 30);

    private final AtomizerPipeline pipeline = new AtomizerPipeline(ArchiveAtomizer.class.getSimpleName(), Modality.ARCHIVE);
    private final List<Codec> codecs;
    private final long maxEntryBytes;

    @Inject
    public ArchiveAtomizer(Instance<Codec> codecs,
                           @ConfigProperty(name = "atomizer.archive.max-entry-bytes", defaultValue = "104857600")
                           long maxEntryBytes) {
        this(StreamSupport.stream(codecs.spliterator(), false).toList(), maxEntryBytes);
    }

    public ArchiveAtomizer(List<Codec> codecs, long maxEntryBytes) {
        this.codecs = List.copyOf(codecs);
        this.maxEntryBytes = maxEntryBytes;
    }

    public ArchiveAtomizer() {
        this(List.of(new GzipCodec(), new Bzip2Codec()), DEFAULT_MAX_ENTRY_BYTES);
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return atomize(content, source, cancellation, Long.MAX_VALUE);
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation,
                                     long expansionBudget) {
        return pipeline.run(content, source, cancellation, ctx -> atomizeArchive(ctx, expansionBudget));
    }

    /** Running state of one archive walk. */
    private final class Walk {
        final AtomizationContext ctx;
        final long budget;
        final AtomGraph.Builder graph = AtomGraph.builder();
        final List<BinaryData> buffers = new ArrayList<>();
        long expanded;
        int entries;
        int skipped;
        int rejected;

        Walk(AtomizationContext ctx, long budget) {
            this.ctx = ctx;
            this.budget = Math.max(0, budget);
        }

        long remaining() {
            return budget - expanded;
        }

        void child(String name, BinaryData data) {
            buffers.add(data);
            expanded += data.size();
            String contentType = ContentTypeDetector.detect(data, name);
            graph.addChildSource(new ChildSource(data, ctx.source().forChild(name, contentType, data.size()),
                    ctx.rootHash(), entries, Position.path(name)));
            entries++;
        }

        void reject(String name, long size) {
            var limit = new ResourceLimitExceededException(EXPANSION_LIMIT, budget, expanded + size);
            log.debugf("Rejected entry %s of %s: %s", name, ctx.source().fileName(), limit.getMessage());
            SourceMetadata child = ctx.source().forChild(name, SourceMetadata.DEFAULT_CONTENT_TYPE, Math.max(size, 0));
            graph.addChildSource(ChildSource.rejected(child, ctx.rootHash(), entries, Position.path(name), limit));
            entries++;
            rejected++;
        }

        void skip(String name, String reason) {
            graph.warn("Skipped entry " + name + " of " + ctx.source().fileName() + ": " + reason);
            skipped++;
        }

        void discard() {
            for (BinaryData buffer : buffers) {
                try {
                    buffer.close();
                } catch (IOException e) {
                    log.warnf(e, "Failed to release entry buffer of %s", ctx.source().fileName());
                }
            }
        }

        FormatOutcome outcome(String format) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("format", format);
            summary.put("entries", entries);
            summary.put("skipped", skipped);
            summary.put("rejected", rejected);
            summary.put("expandedBytes", expanded);
            return new FormatOutcome(format, summary, graph.build());
        }
    }

    private FormatOutcome atomizeArchive(AtomizationContext ctx, long expansionBudget) throws IOException {
        Walk walk = new Walk(ctx, expansionBudget);
        try {
            return walk(walk);
        } catch (RuntimeException | IOException e) {
            walk.discard();
            throw e;
        }
    }

    private FormatOutcome walk(Walk walk) throws IOException {
        AtomizationContext ctx = walk.ctx;
        byte[] header = ctx.content().readHeader(TAR_MAGIC_OFFSET + TAR_MAGIC.length);
        String name = ctx.source().fileName();

        if (startsWith(header, 0, ZIP_MAGIC) || startsWith(header, 0, ZIP_EMPTY_MAGIC)) {
            readZip(walk, ctx.content());
            return walk.outcome("application/zip");
        }
        if (isTar(header)) {
            readTar(walk, ctx.content());
            return walk.outcome("application/x-tar");
        }

        Optional<Codec> codec = codecs.stream().filter(c -> c.matches(header, name)).findFirst();
        if (codec.isEmpty()) {
            throw new StructuralParseException("Unrecognised archive format: " + name);
        }
        String decodedName = codec.get().decodedName(name);
        BinaryData decoded;
        long remaining = walk.remaining();
        try {
            decoded = codec.get().decode(ctx.content(), Math.min(maxEntryBytes, remaining));
        } catch (ResourceLimitExceededException e) {
            if (remaining < maxEntryBytes) {
                walk.reject(decodedName, e.observed());
            } else {
                walk.skip(decodedName, e.getMessage());
            }
            return walk.outcome(compressedFormat(codec.get(), false));
        }

        if (isTar(decoded.readHeader(TAR_MAGIC_OFFSET + TAR_MAGIC.length))
                || decodedName.toLowerCase(Locale.ROOT).endsWith(".tar")) {
            try {
                readTar(walk, decoded);
            } finally {
                decoded.close();
            }
            return walk.outcome(compressedFormat(codec.get(), true));
        }
        walk.child(decodedName, decoded);
        return walk.outcome(compressedFormat(codec.get(), false));
    }

    private void readZip(Walk walk, BinaryData content) throws IOException {
        try (ZipFile zip = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(content.toByteArray()))
                .get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                walk.ctx.checkCancelled();
                ZipArchiveEntry entry = entries.nextElement();
                if (entry.isDirectory() || entry.isUnixSymlink()) {
                    continue;
                }
                if (entry.getSize() > maxEntryBytes) {
                    walk.skip(entry.getName(), "size " + entry.getSize() + " exceeds " + maxEntryBytes);
                    continue;
                }
                if (!zip.canReadEntryData(entry)) {
                    walk.skip(entry.getName(), "unsupported compression or encryption");
                    continue;
                }
                try (InputStream in = zip.getInputStream(entry)) {
                    copyEntry(walk, entry.getName(), in, entry.getSize());
                }
            }
        } catch (IOException e) {
            log.debugf("ZIP read failed for %s: %s", walk.ctx.source().fileName(), e.getMessage());
            throw new StructuralParseException("Corrupt ZIP archive " + walk.ctx.source().fileName()
                    + ": " + e.getMessage(), e);
        }
    }

    private void readTar(Walk walk, BinaryData content) {
        try (TarArchiveInputStream tar = new TarArchiveInputStream(content.inputStream(0))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                walk.ctx.checkCancelled();
                if (entry.isDirectory() || !entry.isFile()) {
                    continue;
                }
                if (entry.getSize() > maxEntryBytes) {
                    walk.skip(entry.getName(), "size " + entry.getSize() + " exceeds " + maxEntryBytes);
                    continue;
                }
                copyEntry(walk, entry.getName(), tar, entry.getSize());
            }
        } catch (IOException e) {
            throw new StructuralParseException("Corrupt TAR archive " + walk.ctx.source().fileName()
                    + ": " + e.getMessage(), e);
        }
    }

    private void copyEntry(Walk walk, String name, InputStream in, long size) throws IOException {
        long remaining = walk.remaining();
        if (size > remaining) {
            walk.reject(name, size);
            return;
        }
        Buffer data;
        try {
            data = BoundedCopy.copy(in, size, Math.min(maxEntryBytes, remaining), "archive entry size");
        } catch (ResourceLimitExceededException e) {
            // sizes from the archive directory can lie; the copy limit is authoritative
            if (remaining < maxEntryBytes) {
                walk.reject(name, e.observed());
            } else {
                walk.skip(name, e.getMessage());
            }
            return;
        }
        walk.child(name, data);
    }

    private static String compressedFormat(Codec codec, boolean tar) {
        String base = codec instanceof Bzip2Codec ? "application/x-bzip2" : "application/gzip";
        return tar ? base + "+tar" : base;
    }

    static boolean isTar(byte[] header) {
        return startsWith(header, TAR_MAGIC_OFFSET, TAR_MAGIC);
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (data.length < offset + prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
