package com.libragraph.atomizer.formats.atomizers.model;

import com.libragraph.atomizer.formats.api.StructuralParseException;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian primitive reader that tracks its offset and turns premature end of data
 * into {@link StructuralParseException}. Lengths read from the file are checked against
 * the bytes that remain, so corrupt headers cannot trigger huge allocations.
 */
final class LittleEndianInput implements AutoCloseable {

    private final InputStream in;
    private final long size;
    private final ByteBuffer scratch = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
    private long position;

    LittleEndianInput(InputStream in, long size) {
        this.in = new BufferedInputStream(in, 64 * 1024);
        this.size = size;
    }

    long position() {
        return position;
    }

    long remaining() {
        return size - position;
    }

    int u8() throws IOException {
        return fill(1).get(0) & 0xFF;
    }

    short i16() throws IOException {
        return fill(2).getShort(0);
    }

    int i32() throws IOException {
        return fill(4).getInt(0);
    }

    long u32() throws IOException {
        return Integer.toUnsignedLong(i32());
    }

    long i64() throws IOException {
        return fill(8).getLong(0);
    }

    float f32() throws IOException {
        return fill(4).getFloat(0);
    }

    double f64() throws IOException {
        return fill(8).getDouble(0);
    }

    /**
     * Reads a length the file declares for something that follows it, rejecting values
     * that are negative or exceed the remaining bytes.
     */
    int length(long declared, String what) {
        if (declared < 0 || declared > remaining() || declared > Integer.MAX_VALUE - 8) {
            throw new StructuralParseException("Invalid " + what + " length " + Long.toUnsignedString(declared)
                    + " at offset " + position);
        }
        return (int) declared;
    }

    byte[] bytes(int length) throws IOException {
        byte[] data = in.readNBytes(length);
        if (data.length < length) {
            throw new StructuralParseException("Unexpected end of data at offset " + (position + data.length));
        }
        position += length;
        return data;
    }

    String utf8(int length) throws IOException {
        return new String(bytes(length), StandardCharsets.UTF_8);
    }

    void skip(long count) throws IOException {
        if (count < 0 || count > remaining()) {
            throw new StructuralParseException("Cannot skip " + count + " bytes at offset " + position);
        }
        in.skipNBytes(count);
        position += count;
    }

    private ByteBuffer fill(int count) throws IOException {
        int read = in.readNBytes(scratch.array(), 0, count);
        if (read < count) {
            throw new StructuralParseException("Unexpected end of data at offset " + (position + read));
        }
        position += count;
        return scratch;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
