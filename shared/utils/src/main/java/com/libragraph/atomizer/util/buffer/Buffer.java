package com.libragraph.atomizer.util.buffer;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;

/**
 * Writable {@link BinaryData}. Codecs and archive extraction decompress into buffers,
 * which are then handed on as child content and closed by whoever consumes them.
 *
 * <p>{@link #allocate(long)} keeps small payloads on the heap and spills large ones to a temp file.
 */
public abstract class Buffer extends BinaryData {

    /** Expected sizes from this threshold on are spilled to a temp file. */
    public static final long SPILL_THRESHOLD = 4L * 1024 * 1024;

    /**
     * Allocates a {@link RamBuffer} below {@link #SPILL_THRESHOLD}, otherwise a {@link FileBuffer}
     * in the default temp directory.
     */
    public static Buffer allocate(long expectedSize) {
        if (expectedSize < SPILL_THRESHOLD) {
            return new RamBuffer((int) Math.max(expectedSize, 16));
        }
        try {
            return FileBuffer.createTemp();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate file-backed buffer", e);
        }
    }

    /**
     * Opens an OutputStream positioned at the given offset. Closing the stream flushes it
     * and leaves this buffer open.
     */
    public OutputStream outputStream(long pos) {
        try {
            position(pos);
            return new FilterOutputStream(Channels.newOutputStream(this)) {
                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    out.write(b, off, len);
                }

                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output stream at position " + pos, e);
        }
    }

    static void checkPosition(long newPosition) {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
    }
}
