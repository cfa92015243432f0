package com.libragraph.atomizer.core.ingest;

import com.libragraph.atomizer.core.dispatch.NodeOutcome;
import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.util.ContentHash;

import java.util.List;

/**
 * Aggregate of one ingestion: every node of the recursion tree, the deduplicated atoms,
 * all compositions (including parent-to-child root edges), and warnings and failures
 * prefixed with the node path they came from.
 */
public record IngestionResult(
        SourceMetadata source,
        ContentHash rootHash,
        List<NodeOutcome> nodes,
        List<Atom> atoms,
        List<AtomComposition> compositions,
        List<String> warnings,
        List<String> failures,
        Stats stats
) {
    public IngestionResult {
        nodes = List.copyOf(nodes);
        atoms = List.copyOf(atoms);
        compositions = List.copyOf(compositions);
        warnings = List.copyOf(warnings);
        failures = List.copyOf(failures);
    }

    /**
     * @param totalAtoms  atom emissions summed over all nodes
     * @param uniqueAtoms distinct hashes across the whole tree
     */
    public record Stats(int nodes, int failedNodes, long totalAtoms, int uniqueAtoms,
                        int compositions, long durationMs) {}

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
