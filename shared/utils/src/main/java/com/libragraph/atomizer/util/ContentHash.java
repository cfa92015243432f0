package com.libragraph.atomizer.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a SHA-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>This is the deduplication key handed to the atom store: identical hash
 * means identical hash input.
 */
public record ContentHash(byte[] bytes) {
    public static final int HASH_LENGTH = 32;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (SHA-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * SHA-256 of the given bytes.
     */
    public static ContentHash of(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new ContentHash(DigestUtils.sha256(data));
    }

    /**
     * SHA-256 of a slice of the given bytes.
     */
    public static ContentHash of(byte[] data, int offset, int length) {
        MessageDigest digest = DigestUtils.getSha256Digest();
        digest.update(data, offset, length);
        return new ContentHash(digest.digest());
    }

    /**
     * SHA-256 of a UTF-8 string.
     */
    public static ContentHash ofUtf8(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * SHA-256 over a domain tag followed by the stream contents.
     * Reads the stream to its end but does not close it.
     */
    public static ContentHash ofTagged(String tag, InputStream in) throws IOException {
        MessageDigest digest = DigestUtils.getSha256Digest();
        digest.update(tag.getBytes(StandardCharsets.UTF_8));
        return new ContentHash(DigestUtils.updateDigest(digest, in).digest());
    }

    /**
     * Creates ContentHash from hex string (64 characters).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException(
                "SHA-256 hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
