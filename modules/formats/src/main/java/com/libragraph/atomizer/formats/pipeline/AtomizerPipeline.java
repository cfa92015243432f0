package com.libragraph.atomizer.formats.pipeline;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomizationException;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.ProcessingInfo;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.Fingerprint;
import com.libragraph.atomizer.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared skeleton every atomizer runs its format step through.
 *
 * <ol>
 *   <li>Hashes the content into the root hash ({@value #ROOT_TAG} followed by the content bytes).</li>
 *   <li>Runs the format step, which returns an {@link AtomGraph} fragment.</li>
 *   <li>Emits the file-metadata atom and folds the fragment under it.</li>
 *   <li>Fills in {@link ProcessingInfo}.</li>
 * </ol>
 *
 * Zero-length content skips the format step. Structural failures are logged and rethrown;
 * warnings recorded by the step pass through.
 * Instances are immutable and shared by all invocations of their atomizer.
 */
public final class AtomizerPipeline {

    private static final Logger log = Logger.getLogger(AtomizerPipeline.class);

    public static final String ROOT_TAG = "file-metadata:";

    /** Detected format reported for zero-length content, which yields the metadata atom only. */
    public static final String EMPTY_FORMAT = "empty";

    private final String atomizerType;
    private final Modality modality;

    public AtomizerPipeline(String atomizerType, Modality modality) {
        this.atomizerType = atomizerType;
        this.modality = modality;
    }

    public String atomizerType() {
        return atomizerType;
    }

    public Modality modality() {
        return modality;
    }

    public AtomizationResult run(BinaryData content, SourceMetadata source,
                                 CancellationToken cancellation, FormatStep step) {
        long start = System.nanoTime();
        log.debugf("Starting atomization of %s (%s) with %s", source.fileName(), source.contentType(), atomizerType);
        cancellation.throwIfCancellationRequested();

        ContentHash rootHash = rootHash(content);
        FormatOutcome outcome;
        try {
            outcome = content.isEmpty()
                    ? new FormatOutcome(EMPTY_FORMAT, Map.of(), AtomGraph.empty())
                    : step.apply(new AtomizationContext(content, source, cancellation, rootHash));
        } catch (StructuralParseException e) {
            log.errorf(e, "Structural failure atomizing %s with %s", source.fileName(), atomizerType);
            throw e;
        } catch (IOException e) {
            log.errorf(e, "I/O failure atomizing %s with %s", source.fileName(), atomizerType);
            throw new AtomizationException("I/O failure atomizing " + source.fileName(), e);
        }
        cancellation.throwIfCancellationRequested();

        AtomGraph graph = outcome.graph();
        Atom root = fileMetadataAtom(rootHash, content.size(), source, outcome);

        List<Atom> atoms = new ArrayList<>(graph.atoms().size() + 1);
        atoms.add(root);
        for (Atom atom : graph.atoms()) {
            if (!atom.contentHash().equals(rootHash)) {
                atoms.add(atom);
            }
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        ProcessingInfo info = new ProcessingInfo(graph.emissions() + 1, atoms.size(), durationMs,
                atomizerType, outcome.detectedFormat(), graph.warnings());

        log.infof("Atomized %s with %s: %d atoms (%d unique), %d compositions, %d children, %d warnings in %dms",
                source.fileName(), atomizerType, info.totalAtoms(), info.uniqueAtoms(),
                graph.compositions().size(), graph.childSources().size(), info.warnings().size(), durationMs);

        return new AtomizationResult(atoms, graph.compositions(), graph.childSources(), info);
    }

    /**
     * Root hash of a content: SHA-256 over {@value #ROOT_TAG} and the content bytes.
     * The tag keeps it apart from a content atom holding the same bytes.
     */
    public static ContentHash rootHash(BinaryData content) {
        try {
            return ContentHash.ofTagged(ROOT_TAG, content.inputStream(0));
        } catch (IOException e) {
            throw new AtomizationException("Failed to hash content", e);
        }
    }

    private Atom fileMetadataAtom(ContentHash rootHash, long size, SourceMetadata source, FormatOutcome outcome) {
        byte[] summary = (modality.label() + ":" + source.fileName() + ":" + size).getBytes(StandardCharsets.UTF_8);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("fileName", source.fileName());
        meta.put("sourceUri", source.sourceUri());
        meta.put("sizeBytes", size);
        meta.put("contentType", source.contentType());
        meta.put("detectedFormat", outcome.detectedFormat());
        meta.putAll(outcome.summary());

        byte[] value = summary;
        if (summary.length > Atom.MAX_SIZE) {
            value = Fingerprint.of(summary).bytes();
            meta.put("overflow", true);
            meta.put("originalSize", summary.length);
            meta.put("fingerprintAlgorithm", Fingerprint.ALGORITHM);
        }

        String canonical = source.fileName() + " (" + size + " bytes, " + outcome.detectedFormat() + ")";
        return new Atom(value, rootHash, modality, Subtypes.FILE_METADATA, source.contentType(),
                canonical, MetadataJson.merge(source.metadata(), meta));
    }
}
