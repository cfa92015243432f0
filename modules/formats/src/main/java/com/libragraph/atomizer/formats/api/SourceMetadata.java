package com.libragraph.atomizer.formats.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Where a byte sequence came from. Immutable; child sources are derived with
 * {@link #forChild(String, String, long)}.
 *
 * @param metadata opaque JSON supplied by the ingestion entry point, or null
 */
public record SourceMetadata(
        String fileName,
        String sourceUri,
        String sourceType,
        String contentType,
        long sizeBytes,
        String tenantId,
        String metadata
) {
    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    public SourceMetadata {
        Objects.requireNonNull(fileName, "fileName");
        if (contentType == null || contentType.isBlank()) {
            contentType = DEFAULT_CONTENT_TYPE;
        }
    }

    public static SourceMetadata of(String fileName, String contentType, long sizeBytes) {
        return new SourceMetadata(fileName, "file:" + fileName, "upload", contentType, sizeBytes, null, null);
    }

    /**
     * Lowercase extension without the dot, or null when the file name has none.
     */
    public String fileExtension() {
        return extensionOf(fileName);
    }

    /**
     * Derives the source of a nested entry. SourceType, TenantId and Metadata carry over unchanged.
     */
    public SourceMetadata forChild(String entryName, String childContentType, long childSize) {
        return new SourceMetadata(entryName, sourceUri + "!/" + entryName, sourceType,
                childContentType, childSize, tenantId, metadata);
    }

    public static String extensionOf(String name) {
        if (name == null) {
            return null;
        }
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        int dot = name.lastIndexOf('.');
        if (dot <= slash + 1 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
