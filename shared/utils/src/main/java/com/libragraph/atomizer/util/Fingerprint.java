package com.libragraph.atomizer.util;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed 64-byte comparison key: the 32-byte SHA-256 of the content followed by
 * the first 32 bytes of the content, zero-padded when the content is shorter.
 *
 * <p>Used as the stored value of atoms whose real payload does not fit in 64 bytes.
 */
public record Fingerprint(byte[] bytes) {
    public static final int LENGTH = 64;
    public static final String ALGORITHM = "SHA256-Truncated-64";

    private static final int EXCERPT_LENGTH = LENGTH - ContentHash.HASH_LENGTH;

    public Fingerprint {
        Objects.requireNonNull(bytes, "Fingerprint bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Fingerprint must be 64 bytes, got: " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    public static Fingerprint of(byte[] content) {
        return of(ContentHash.of(content), content);
    }

    /**
     * Builds the fingerprint from an already computed hash of the full content
     * and (at least) its leading bytes.
     */
    public static Fingerprint of(ContentHash hash, byte[] leadingBytes) {
        byte[] out = new byte[LENGTH];
        System.arraycopy(hash.bytes(), 0, out, 0, ContentHash.HASH_LENGTH);
        System.arraycopy(leadingBytes, 0, out, ContentHash.HASH_LENGTH,
                Math.min(EXCERPT_LENGTH, leadingBytes.length));
        return new Fingerprint(out);
    }

    public ContentHash hash() {
        return new ContentHash(Arrays.copyOf(bytes, ContentHash.HASH_LENGTH));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fingerprint other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "fp:" + hash().toHex();
    }
}
