package com.libragraph.atomizer.util.buffer;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.*;

class RamBufferTest {

    @Test
    void shouldReadAndWrite() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello".getBytes()));

        assertThat(buf.size()).isEqualTo(5);

        buf.position(0);
        ByteBuffer dst = ByteBuffer.allocate(5);
        buf.read(dst);
        dst.flip();
        assertThat(new String(dst.array(), 0, dst.remaining())).isEqualTo("Hello");
    }

    @Test
    void shouldWrapArrayWithoutCopying() {
        byte[] data = "wrapped".getBytes();
        BinaryData bd = BinaryData.of(data);

        assertThat(bd).isInstanceOf(RamBuffer.class);
        assertThat(bd.size()).isEqualTo(7);
        assertThat(bd.toByteArray()).isEqualTo(data);
    }

    @Test
    void shouldOverwriteInPlace() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello".getBytes()));

        buf.position(0);
        buf.write(ByteBuffer.wrap("J".getBytes()));

        assertThat(buf.size()).isEqualTo(5);
        assertThat(new String(buf.toByteArray())).isEqualTo("Jello");
    }

    @Test
    void shouldTruncate() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello, World!".getBytes()));

        buf.truncate(5);

        assertThat(buf.size()).isEqualTo(5);
        assertThat(buf.toByteArray()).isEqualTo("Hello".getBytes());
        assertThat(buf.position()).isEqualTo(5);
    }

    @Test
    void shouldGrowAutomatically() throws Exception {
        Buffer buf = Buffer.allocate(4);
        byte[] data = "Hello, this is longer than 4 bytes".getBytes();
        buf.write(ByteBuffer.wrap(data));

        assertThat(buf.size()).isEqualTo(data.length);
        assertThat(buf.toByteArray()).isEqualTo(data);
    }

    @Test
    void shouldWriteThroughOutputStream() throws Exception {
        Buffer buf = Buffer.allocate(16);
        try (var out = buf.outputStream(0)) {
            out.write("streamed".getBytes());
        }

        assertThat(new String(buf.toByteArray())).isEqualTo("streamed");
    }

    @Test
    void shouldRejectNegativePosition() {
        Buffer buf = Buffer.allocate(16);

        assertThatThrownBy(() -> buf.position(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
