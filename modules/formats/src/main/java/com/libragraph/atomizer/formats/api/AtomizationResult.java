package com.libragraph.atomizer.formats.api;

import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;

import java.util.List;
import java.util.Optional;

/**
 * Output of one atomizer invocation. The first atom is always the file-metadata root.
 */
public record AtomizationResult(
        List<Atom> atoms,
        List<AtomComposition> compositions,
        List<ChildSource> childSources,
        ProcessingInfo processingInfo
) {
    public AtomizationResult {
        atoms = List.copyOf(atoms);
        compositions = List.copyOf(compositions);
        childSources = List.copyOf(childSources);
        if (atoms.isEmpty() || !Subtypes.FILE_METADATA.equals(atoms.get(0).subtype())) {
            throw new IllegalArgumentException("Result must start with a file-metadata atom");
        }
    }

    public Atom rootAtom() {
        return atoms.get(0);
    }

    public ContentHash rootHash() {
        return rootAtom().contentHash();
    }

    public Optional<Atom> findAtom(ContentHash hash) {
        return atoms.stream().filter(a -> a.contentHash().equals(hash)).findFirst();
    }

    public List<Atom> atomsOfSubtype(String subtype) {
        return atoms.stream().filter(a -> a.subtype().equals(subtype)).toList();
    }

    public List<String> warnings() {
        return processingInfo.warnings();
    }
}
