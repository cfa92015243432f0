package com.libragraph.atomizer.formats.pipeline;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.ChildSource;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.Fingerprint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable fragment of an atomization result: atoms (one per hash, in first-emission order),
 * compositions, child sources and warnings. Format steps build one with {@link Builder};
 * the pipeline folds it under the file-metadata root.
 *
 * @param emissions number of atom emissions including repeats of the same hash
 */
public record AtomGraph(
        List<Atom> atoms,
        List<AtomComposition> compositions,
        List<ChildSource> childSources,
        List<String> warnings,
        int emissions
) {
    public AtomGraph {
        atoms = List.copyOf(atoms);
        compositions = List.copyOf(compositions);
        childSources = List.copyOf(childSources);
        warnings = List.copyOf(warnings);
    }

    public static AtomGraph empty() {
        return new AtomGraph(List.of(), List.of(), List.of(), List.of(), 0);
    }

    /**
     * Views a nested atomizer's result as a fragment, root atom included and child sources dropped.
     */
    public static AtomGraph of(AtomizationResult result) {
        return new AtomGraph(result.atoms(), result.compositions(), List.of(), result.warnings(),
                result.processingInfo().totalAtoms());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<ContentHash, Atom> atoms = new LinkedHashMap<>();
        private final List<AtomComposition> compositions = new ArrayList<>();
        private final Set<ContentHash> expanded = new HashSet<>();
        private final Map<ContentHash, Integer> nextSequence = new HashMap<>();
        private final List<ChildSource> childSources = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private int emissions;

        private Builder() {
        }

        /**
         * Adds an atom. A repeated hash counts as an emission but keeps the first atom.
         */
        public ContentHash add(Atom atom) {
            emissions++;
            atoms.putIfAbsent(atom.contentHash(), atom);
            return atom.contentHash();
        }

        /**
         * Adds a payload as one leaf atom, or, when it exceeds {@link Atom#MAX_SIZE}, as a carrier
         * atom (hash of the whole payload, fingerprint as value) whose {@code chunk} children
         * concatenate back to the payload.
         */
        public ContentHash addPayload(Modality modality, String subtype, byte[] payload,
                                      String canonicalText, Map<String, ?> metadata) {
            if (payload.length <= Atom.MAX_SIZE) {
                return add(new Atom(payload, ContentHash.of(payload), modality, subtype, null,
                        canonicalText, MetadataJson.toJson(metadata)));
            }
            ContentHash hash = ContentHash.of(payload);
            add(new Atom(Fingerprint.of(hash, payload).bytes(), hash, modality, subtype, null,
                    canonicalText, MetadataJson.merge(MetadataJson.toJson(metadata), overflow(payload.length, true))));
            if (markExpanded(hash)) {
                for (int offset = 0; offset < payload.length; offset += Atom.MAX_SIZE) {
                    byte[] chunk = Arrays.copyOfRange(payload, offset, Math.min(payload.length, offset + Atom.MAX_SIZE));
                    ContentHash chunkHash = add(Atom.leaf(chunk, modality, Subtypes.CHUNK, null, null));
                    link(hash, chunkHash, Position.offset(offset));
                }
            }
            return hash;
        }

        /**
         * Adds a structural node addressed by a caller-computed hash. The value is {@code summary}
         * when it fits, otherwise its fingerprint; no chunk children are created.
         */
        public ContentHash addNode(ContentHash hash, Modality modality, String subtype, byte[] summary,
                                   String canonicalText, Map<String, ?> metadata) {
            if (summary.length <= Atom.MAX_SIZE) {
                return add(new Atom(summary, hash, modality, subtype, null, canonicalText, MetadataJson.toJson(metadata)));
            }
            return add(new Atom(Fingerprint.of(hash, summary).bytes(), hash, modality, subtype, null,
                    canonicalText, MetadataJson.merge(MetadataJson.toJson(metadata), overflow(summary.length, false))));
        }

        /**
         * {@link #addPayload} followed by {@link #link} under {@code parent}.
         */
        public ContentHash addChild(ContentHash parent, Position position, Modality modality, String subtype,
                                    byte[] payload, String canonicalText, Map<String, ?> metadata) {
            ContentHash hash = addPayload(modality, subtype, payload, canonicalText, metadata);
            link(parent, hash, position);
            return hash;
        }

        /**
         * Appends a composition edge with the next free sequence index of {@code parent}.
         */
        public AtomComposition link(ContentHash parent, ContentHash component, Position position) {
            int sequence = nextSequence.merge(parent, 1, Integer::sum) - 1;
            AtomComposition edge = new AtomComposition(parent, component, sequence, position);
            compositions.add(edge);
            return edge;
        }

        /**
         * Returns true the first time it is called for {@code hash}. Nested atomizers use it so
         * that a repeated subtree links its children only once.
         */
        public boolean markExpanded(ContentHash hash) {
            return expanded.add(hash);
        }

        public boolean contains(ContentHash hash) {
            return atoms.containsKey(hash);
        }

        public Builder addChildSource(ChildSource child) {
            childSources.add(child);
            return this;
        }

        public Builder warn(String warning) {
            warnings.add(warning);
            return this;
        }

        /**
         * Folds another fragment in. Edges of a parent this builder already expanded are skipped,
         * which keeps sequence indices unique when the same subtree is merged twice.
         */
        public Builder merge(AtomGraph other) {
            other.atoms().forEach(a -> atoms.putIfAbsent(a.contentHash(), a));
            emissions += other.emissions();
            Set<ContentHash> parents = new LinkedHashSet<>();
            other.compositions().forEach(c -> parents.add(c.parentAtomHash()));
            Set<ContentHash> fresh = new HashSet<>();
            for (ContentHash parent : parents) {
                if (markExpanded(parent)) {
                    fresh.add(parent);
                }
            }
            for (AtomComposition c : other.compositions()) {
                if (fresh.contains(c.parentAtomHash())) {
                    compositions.add(c);
                    nextSequence.merge(c.parentAtomHash(), c.sequenceIndex() + 1, Math::max);
                }
            }
            childSources.addAll(other.childSources());
            warnings.addAll(other.warnings());
            return this;
        }

        public int warningCount() {
            return warnings.size();
        }

        public AtomGraph build() {
            return new AtomGraph(new ArrayList<>(atoms.values()), compositions, childSources, warnings, emissions);
        }

        private static Map<String, Object> overflow(int originalSize, boolean chunked) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("overflow", true);
            meta.put("originalSize", originalSize);
            meta.put("fingerprintAlgorithm", Fingerprint.ALGORITHM);
            if (chunked) {
                meta.put("chunkCount", (originalSize + Atom.MAX_SIZE - 1) / Atom.MAX_SIZE);
            }
            return meta;
        }
    }
}
