package com.libragraph.atomizer.core.store;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.util.ContentHash;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link AtomSink}, used unless the application provides another one.
 * Atoms are stored once per hash with a reference count; compositions are keyed by
 * {@code (parent, sequenceIndex)}, so re-storing the same edge is idempotent.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryAtomStore implements AtomSink {

    private static final Logger log = Logger.getLogger(InMemoryAtomStore.class);

    private record Stored(Atom atom, AtomicLong references) {}

    private final Map<ContentHash, Stored> atoms = new ConcurrentHashMap<>();
    private final Map<ContentHash, ConcurrentSkipListMap<Integer, AtomComposition>> compositions = new ConcurrentHashMap<>();

    @Override
    public void upsertAtoms(Collection<Atom> batch) {
        int created = 0;
        for (Atom atom : batch) {
            Stored stored = atoms.computeIfAbsent(atom.contentHash(), h -> new Stored(atom, new AtomicLong()));
            if (stored.references().getAndIncrement() == 0) {
                created++;
            }
        }
        log.debugf("Upserted %d atoms (%d new)", batch.size(), created);
    }

    @Override
    public void storeCompositions(Collection<AtomComposition> batch) {
        for (AtomComposition c : batch) {
            compositions.computeIfAbsent(c.parentAtomHash(), h -> new ConcurrentSkipListMap<>())
                    .putIfAbsent(c.sequenceIndex(), c);
        }
    }

    public Optional<Atom> find(ContentHash hash) {
        return Optional.ofNullable(atoms.get(hash)).map(Stored::atom);
    }

    public long referenceCount(ContentHash hash) {
        Stored stored = atoms.get(hash);
        return stored == null ? 0 : stored.references().get();
    }

    /**
     * Components of {@code parent} in sequence order.
     */
    public List<AtomComposition> componentsOf(ContentHash parent) {
        var children = compositions.get(parent);
        return children == null ? List.of() : new ArrayList<>(children.values());
    }

    public int atomCount() {
        return atoms.size();
    }

    public int compositionCount() {
        return compositions.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Concatenates the leaves under {@code hash} in sequence order. Lossless for
     * atomizers whose components partition their parent (text, binary, oversized payloads).
     *
     * @throws IllegalStateException if a referenced atom is missing or the graph has a cycle
     */
    public byte[] reconstruct(ContentHash hash) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        append(hash, out, new HashSet<>());
        return out.toByteArray();
    }

    private void append(ContentHash hash, ByteArrayOutputStream out, Set<ContentHash> path) {
        Atom atom = find(hash).orElseThrow(() -> new IllegalStateException("Missing atom " + hash));
        List<AtomComposition> children = componentsOf(hash);
        if (children.isEmpty()) {
            out.writeBytes(atom.atomicValue());
            return;
        }
        if (!path.add(hash)) {
            throw new IllegalStateException("Composition cycle at " + hash);
        }
        children.forEach(c -> append(c.componentAtomHash(), out, path));
        path.remove(hash);
    }
}
