package com.libragraph.atomizer.core.store;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;

import java.util.Collection;

/**
 * Persistence collaborator receiving the output of completed ingestions.
 * Upserts are keyed by content hash; a repeated hash increments its reference count.
 * Implementations must be thread-safe.
 */
public interface AtomSink {

    void upsertAtoms(Collection<Atom> atoms);

    void storeCompositions(Collection<AtomComposition> compositions);
}
