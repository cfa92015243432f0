package com.libragraph.atomizer.formats.api;

import com.libragraph.atomizer.util.buffer.BinaryData;

/**
 * Transport-level decoder for compressed single-stream payloads (gzip, bzip2).
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface Codec {

    /**
     * Checks if this codec can handle the given payload.
     *
     * @param header   First bytes of the payload (typically 8-16 bytes)
     * @param filename Original filename (may contain hints like .gz extension)
     */
    boolean matches(byte[] header, String filename);

    /**
     * Decodes the input, refusing to produce more than {@code maxBytes}.
     *
     * @throws ResourceLimitExceededException when the decoded size passes {@code maxBytes}
     * @throws StructuralParseException when the stream is corrupt
     */
    BinaryData decode(BinaryData input, long maxBytes);

    /**
     * Name of the decoded payload given the encoded one (e.g. {@code a.txt.gz} to {@code a.txt}).
     */
    String decodedName(String filename);
}
