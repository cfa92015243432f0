package com.libragraph.atomizer.formats.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Criteria for deciding whether an atomizer handles a source.
 *
 * @param mimeTypes    MIME types to match (e.g., "application/zip", "text/*")
 * @param extensions   File extensions without dot (e.g., "zip", "tar")
 * @param magicBytes   Magic bytes to match, or null if not applicable
 * @param magicOffset  Offset in header where magic bytes start (0 for most formats, 257 for TAR)
 * @param priority     Higher priority wins on conflict (e.g., GGUF=60 beats Binary=0)
 */
public record DetectionCriteria(
        Set<String> mimeTypes,
        Set<String> extensions,
        byte[] magicBytes,
        int magicOffset,
        int priority
) {
    public DetectionCriteria {
        mimeTypes = Set.copyOf(mimeTypes);
        extensions = Set.copyOf(extensions);
        if (magicBytes != null) {
            magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
        }
    }

    public static DetectionCriteria of(int priority, Set<String> mimeTypes, Set<String> extensions) {
        return new DetectionCriteria(mimeTypes, extensions, null, 0, priority);
    }

    /**
     * Creates criteria that match every source (fallback atomizer).
     *
     * @param priority priority for this catch-all (typically 0)
     */
    public static DetectionCriteria catchAll(int priority) {
        return new DetectionCriteria(Set.of("*/*"), Set.of("*"), null, 0, priority);
    }

    /**
     * True for criteria built by {@link #catchAll(int)}, which accept any declaration.
     */
    public boolean isCatchAll() {
        return mimeTypes.contains("*/*");
    }

    /**
     * Checks MIME type and extension; the dispatch predicate.
     *
     * @param mimeType  declared content type, may be null
     * @param extension extension with or without leading dot, may be null
     */
    public boolean matches(String mimeType, String extension) {
        if (mimeTypes.contains("*/*")) {
            return true;
        }
        if (mimeType != null) {
            String normalized = normalizeMime(mimeType);
            if (mimeTypes.contains(normalized)) {
                return true;
            }
            int slash = normalized.indexOf('/');
            if (slash > 0 && mimeTypes.contains(normalized.substring(0, slash) + "/*")) {
                return true;
            }
        }

        if (extensions.contains("*")) {
            return true;
        }
        String ext = normalizeExtension(extension);
        return ext != null && extensions.contains(ext);
    }

    /**
     * Checks MIME type, extension, and magic bytes in the header.
     */
    public boolean matches(String mimeType, String extension, byte[] header) {
        return matchesMagic(header) || matches(mimeType, extension);
    }

    public boolean matchesMagic(byte[] header) {
        if (magicBytes == null || header == null) {
            return false;
        }
        int endOffset = magicOffset + magicBytes.length;
        if (header.length < endOffset) {
            return false;
        }
        for (int i = 0; i < magicBytes.length; i++) {
            if (header[magicOffset + i] != magicBytes[i]) {
                return false;
            }
        }
        return true;
    }

    public static String normalizeMime(String mimeType) {
        int semicolon = mimeType.indexOf(';');
        String base = semicolon >= 0 ? mimeType.substring(0, semicolon) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return null;
        }
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return ext.toLowerCase(Locale.ROOT);
    }
}
