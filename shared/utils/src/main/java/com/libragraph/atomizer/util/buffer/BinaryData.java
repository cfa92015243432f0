package com.libragraph.atomizer.util.buffer;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only binary data backed by RAM, a temp file, or any wrapped channel.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * Provides convenience methods for stream-based access, positional reads and format detection.
 *
 * Design principles:
 * - Size is always available; hashing is left to callers, which hash what they emit
 * - Stream access uses standard JDK wrappers (Channels.newInputStream)
 * - Whole-content materialization is explicit ({@link #toByteArray()}) and bounded by the array limit
 *
 * Instances carry a channel position and are not safe for concurrent use.
 */
public abstract class BinaryData implements SeekableByteChannel {

    /** Largest content {@link #toByteArray()} will materialize. */
    public static final long MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        return new WrappedBinaryData(channel);
    }

    /**
     * Wraps a byte array without copying. The caller must not modify the array afterwards.
     */
    public static BinaryData of(byte[] data) {
        return new RamBuffer(data);
    }

    /**
     * Total size in bytes.
     */
    public abstract long size();

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * Uses standard JDK Channels.newInputStream() wrapper.
     * The stream shares this channel's position; closing it leaves this channel open.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return new FilterInputStream(Channels.newInputStream(this)) {
                @Override
                public void close() {
                    // owned by the BinaryData
                }
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create input stream at position " + pos, e);
        }
    }

    /**
     * Reads the first N bytes as a header (for format detection).
     * Does not advance the buffer position.
     *
     * Hard limit: min(maxBytes, 64KB) to prevent unbounded reads.
     *
     * @param maxBytes maximum bytes to read
     * @return header bytes (may be shorter than maxBytes if data is smaller)
     */
    public byte[] readHeader(int maxBytes) {
        int limit = Math.min(maxBytes, 64 * 1024);
        return readAt(0, (int) Math.min(limit, size()));
    }

    /**
     * Reads up to {@code length} bytes starting at {@code pos} without moving the channel position.
     * The returned array is shorter than requested only when the data ends first.
     */
    public byte[] readAt(long pos, int length) {
        if (pos < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: pos=" + pos + ", length=" + length);
        }
        int toRead = (int) Math.max(0, Math.min(length, size() - pos));
        try {
            long originalPos = position();
            position(pos);

            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            while (buffer.hasRemaining()) {
                if (read(buffer) == -1) {
                    break;
                }
            }

            position(originalPos);

            byte[] bytes = new byte[buffer.position()];
            buffer.flip();
            buffer.get(bytes);
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + length + " bytes at " + pos, e);
        }
    }

    /**
     * Materializes the whole content.
     *
     * @throws IllegalStateException if the content exceeds {@link #MAX_ARRAY_SIZE}
     */
    public byte[] toByteArray() {
        long size = size();
        if (size > MAX_ARRAY_SIZE) {
            throw new IllegalStateException("Content too large to materialize: " + size + " bytes");
        }
        return readAt(0, (int) size);
    }
}
