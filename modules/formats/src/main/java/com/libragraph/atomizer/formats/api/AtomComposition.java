package com.libragraph.atomizer.formats.api;

import com.libragraph.atomizer.util.ContentHash;

import java.util.Objects;

/**
 * Directed structural edge: {@code componentAtomHash} is the {@code sequenceIndex}-th part of
 * {@code parentAtomHash}. The store keys edges by {@code (parentAtomHash, sequenceIndex)}.
 *
 * @param position optional structural coordinate, or null
 */
public record AtomComposition(
        ContentHash parentAtomHash,
        ContentHash componentAtomHash,
        int sequenceIndex,
        Position position
) {
    public AtomComposition {
        Objects.requireNonNull(parentAtomHash, "parentAtomHash");
        Objects.requireNonNull(componentAtomHash, "componentAtomHash");
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("Sequence index must be non-negative, got: " + sequenceIndex);
        }
    }
}
