package com.libragraph.atomizer.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;

/**
 * Buffer implementation using an in-memory byte array.
 * Suitable for small payloads (&lt; 4MB) and for wrapping content handed to an atomizer.
 *
 * Grows automatically on writes past the current capacity.
 */
public class RamBuffer extends Buffer {
    private byte[] data;
    private long position;
    private long size;  // Logical size (may be less than data.length)

    /**
     * Creates empty buffer with initial capacity.
     */
    public RamBuffer(int initialCapacity) {
        this.data = new byte[initialCapacity];
        this.position = 0;
        this.size = 0;
    }

    /**
     * Wraps existing data without copying.
     */
    public RamBuffer(byte[] data) {
        this.data = data;
        this.position = 0;
        this.size = data.length;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (position >= size) {
            return -1;
        }

        int remaining = (int) (size - position);
        int toRead = Math.min(remaining, dst.remaining());
        dst.put(data, (int) position, toRead);
        position += toRead;
        return toRead;
    }

    @Override
    public byte[] toByteArray() {
        return Arrays.copyOf(data, (int) size);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int toWrite = src.remaining();
        long endPosition = position + toWrite;
        if (endPosition > MAX_ARRAY_SIZE) {
            throw new IOException("RamBuffer cannot grow beyond " + MAX_ARRAY_SIZE + " bytes");
        }

        if (endPosition > data.length) {
            grow(endPosition);
        }

        src.get(data, (int) position, toWrite);
        position += toWrite;

        if (position > size) {
            size = position;
        }

        return toWrite;
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        if (newSize < size) {
            size = newSize;
            if (position > size) {
                position = size;
            }
        }
        return this;
    }

    @Override
    public long position() throws IOException {
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        checkPosition(newPosition);
        this.position = newPosition;
        return this;
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void close() throws IOException {
        // heap only
    }

    /**
     * Doubles capacity each time to amortize growth cost.
     */
    private void grow(long minCapacity) {
        long newCapacity = Math.min(Math.max(data.length * 2L, minCapacity), MAX_ARRAY_SIZE);
        data = Arrays.copyOf(data, (int) newCapacity);
    }
}
