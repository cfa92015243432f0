package com.libragraph.atomizer.formats.api;

import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.util.ContentHash;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Indivisible, content-addressed unit of decomposed content.
 *
 * @param atomicValue   stored bytes, at most {@link #MAX_SIZE} bytes
 * @param contentHash   SHA-256 of the hash input (not necessarily of {@code atomicValue})
 * @param modality      coarse content family
 * @param subtype       atomizer-defined classifier (see {@link com.libragraph.atomizer.types.Subtypes})
 * @param contentType   MIME type, or null
 * @param canonicalText human-readable rendering, or null
 * @param metadata      JSON object string of atomizer-specific attributes, or null
 */
public record Atom(
        byte[] atomicValue,
        ContentHash contentHash,
        Modality modality,
        String subtype,
        String contentType,
        String canonicalText,
        String metadata
) {
    public static final int MAX_SIZE = 64;

    public Atom {
        Objects.requireNonNull(atomicValue, "atomicValue");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(modality, "modality");
        Objects.requireNonNull(subtype, "subtype");
        if (atomicValue.length > MAX_SIZE) {
            throw new IllegalArgumentException(
                    "Atomic value must be at most " + MAX_SIZE + " bytes, got: " + atomicValue.length);
        }
        atomicValue = Arrays.copyOf(atomicValue, atomicValue.length);
    }

    /**
     * Leaf atom whose hash input is exactly its stored value.
     */
    public static Atom leaf(byte[] value, Modality modality, String subtype, String canonicalText, String metadata) {
        return new Atom(value, ContentHash.of(value), modality, subtype, null, canonicalText, metadata);
    }

    @Override
    public byte[] atomicValue() {
        return Arrays.copyOf(atomicValue, atomicValue.length);
    }

    public int size() {
        return atomicValue.length;
    }

    /**
     * Stored value decoded as UTF-8, for diagnostics and tests.
     */
    public String valueAsUtf8() {
        return new String(atomicValue, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Atom other)) return false;
        return Arrays.equals(atomicValue, other.atomicValue)
                && contentHash.equals(other.contentHash)
                && modality == other.modality
                && subtype.equals(other.subtype)
                && Objects.equals(contentType, other.contentType)
                && Objects.equals(canonicalText, other.canonicalText)
                && Objects.equals(metadata, other.metadata);
    }

    @Override
    public int hashCode() {
        return contentHash.hashCode();
    }

    @Override
    public String toString() {
        return "Atom[" + modality.label() + "/" + subtype + " " + contentHash.toHex().substring(0, 12)
                + " " + atomicValue.length + "B]";
    }
}
