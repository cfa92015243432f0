package com.libragraph.atomizer.formats.atomizers.media;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Raster image container signatures.
 */
enum ImageSignature {
    PNG("image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}),
    JPEG("image/jpeg", new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}),
    GIF87("image/gif", "GIF87a".getBytes(StandardCharsets.US_ASCII)),
    GIF89("image/gif", "GIF89a".getBytes(StandardCharsets.US_ASCII)),
    BMP("image/bmp", new byte[]{'B', 'M'}),
    TIFF_LE("image/tiff", new byte[]{'I', 'I', 0x2A, 0x00}),
    TIFF_BE("image/tiff", new byte[]{'M', 'M', 0x00, 0x2A}),
    WEBP("image/webp", null);

    private final String mimeType;
    private final byte[] magic;

    ImageSignature(String mimeType, byte[] magic) {
        this.mimeType = mimeType;
        this.magic = magic;
    }

    String mimeType() {
        return mimeType;
    }

    static Optional<ImageSignature> detect(byte[] header) {
        for (ImageSignature signature : values()) {
            if (signature.matches(header)) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }

    private boolean matches(byte[] header) {
        if (this == WEBP) {
            return header.length >= 12
                    && header[0] == 'R' && header[1] == 'I' && header[2] == 'F' && header[3] == 'F'
                    && header[8] == 'W' && header[9] == 'E' && header[10] == 'B' && header[11] == 'P';
        }
        if (header.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
