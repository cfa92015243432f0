package com.libragraph.atomizer.formats.codecs;

import com.libragraph.atomizer.formats.api.Codec;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Codec for GZIP compression (.gz files).
 * Handles both single .gz files and .tar.gz archives.
 */
@ApplicationScoped
public class GzipCodec implements Codec {
    private static final byte[] GZIP_MAGIC = new byte[]{0x1f, (byte) 0x8b};

    @Override
    public boolean matches(byte[] header, String filename) {
        if (header.length >= 2 && header[0] == GZIP_MAGIC[0] && header[1] == GZIP_MAGIC[1]) {
            return true;
        }
        if (filename != null) {
            String lower = filename.toLowerCase(Locale.ROOT);
            return lower.endsWith(".gz") || lower.endsWith(".gzip") || lower.endsWith(".tgz");
        }
        return false;
    }

    @Override
    public BinaryData decode(BinaryData input, long maxBytes) {
        try (GZIPInputStream gzip = new GZIPInputStream(input.inputStream(0))) {
            return BoundedCopy.copy(gzip, input.size() * 4, maxBytes, "gzip decompressed size");
        } catch (IOException e) {
            throw new StructuralParseException("Failed to decompress GZIP", e);
        }
    }

    @Override
    public String decodedName(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tgz")) {
            return filename.substring(0, filename.length() - 4) + ".tar";
        }
        if (lower.endsWith(".gzip")) {
            return filename.substring(0, filename.length() - 5);
        }
        if (lower.endsWith(".gz")) {
            return filename.substring(0, filename.length() - 3);
        }
        return filename;
    }
}
