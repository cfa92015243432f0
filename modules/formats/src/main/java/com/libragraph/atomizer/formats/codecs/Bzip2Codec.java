package com.libragraph.atomizer.formats.codecs;

import com.libragraph.atomizer.formats.api.Codec;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

import java.io.IOException;
import java.util.Locale;

/**
 * Codec for BZIP2 compression (.bz2 files).
 * Uses Apache Commons Compress for BZIP2 support.
 */
@ApplicationScoped
public class Bzip2Codec implements Codec {
    private static final byte[] BZIP2_MAGIC = new byte[]{'B', 'Z', 'h'};

    @Override
    public boolean matches(byte[] header, String filename) {
        if (header.length >= 3 &&
            header[0] == BZIP2_MAGIC[0] &&
            header[1] == BZIP2_MAGIC[1] &&
            header[2] == BZIP2_MAGIC[2]) {
            return true;
        }
        if (filename != null) {
            String lower = filename.toLowerCase(Locale.ROOT);
            return lower.endsWith(".bz2") || lower.endsWith(".bzip2") || lower.endsWith(".tbz2");
        }
        return false;
    }

    @Override
    public BinaryData decode(BinaryData input, long maxBytes) {
        try (BZip2CompressorInputStream bzip2 = new BZip2CompressorInputStream(input.inputStream(0), true)) {
            return BoundedCopy.copy(bzip2, input.size() * 5, maxBytes, "bzip2 decompressed size");
        } catch (IOException e) {
            throw new StructuralParseException("Failed to decompress BZIP2", e);
        }
    }

    @Override
    public String decodedName(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tbz2")) {
            return filename.substring(0, filename.length() - 5) + ".tar";
        }
        if (lower.endsWith(".bzip2")) {
            return filename.substring(0, filename.length() - 6);
        }
        if (lower.endsWith(".bz2")) {
            return filename.substring(0, filename.length() - 4);
        }
        return filename;
    }
}
