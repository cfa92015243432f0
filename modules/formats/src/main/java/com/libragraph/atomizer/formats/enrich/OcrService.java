package com.libragraph.atomizer.formats.enrich;

/**
 * Optional text recognition capability. Implementations must be thread-safe.
 */
public interface OcrService {

    OcrResult recognize(byte[] image, String contentType) throws Exception;

    record OcrResult(String text, double confidence) {
    }
}
