package com.libragraph.atomizer.util.buffer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileBufferTest {

    @TempDir
    Path spillDir;

    @Test
    void shouldSpillLargeAllocationsToFile() throws Exception {
        try (Buffer buf = Buffer.allocate(Buffer.SPILL_THRESHOLD)) {
            assertThat(buf).isInstanceOf(FileBuffer.class);
        }
        try (Buffer buf = Buffer.allocate(Buffer.SPILL_THRESHOLD - 1)) {
            assertThat(buf).isInstanceOf(RamBuffer.class);
        }
    }

    @Test
    void shouldWriteAndReadAtOffset() throws Exception {
        try (FileBuffer buf = FileBuffer.createIn(spillDir)) {
            buf.write(ByteBuffer.wrap("file backed".getBytes()));

            assertThat(buf.size()).isEqualTo(11);
            assertThat(new String(buf.readAt(5, 6))).isEqualTo("backed");
            assertThat(new String(buf.inputStream(0).readAllBytes())).isEqualTo("file backed");
        }
    }

    @Test
    void shouldTruncateAndClampPosition() throws Exception {
        try (FileBuffer buf = FileBuffer.createIn(spillDir)) {
            buf.write(ByteBuffer.wrap("0123456789".getBytes()));

            buf.truncate(4);

            assertThat(buf.size()).isEqualTo(4);
            assertThat(buf.position()).isEqualTo(4);
            assertThat(new String(buf.toByteArray())).isEqualTo("0123");
        }
    }

    @Test
    void shouldDeleteSpillFileOnClose() throws Exception {
        FileBuffer buf = FileBuffer.createIn(spillDir);
        Path file = buf.file();
        assertThat(file).exists().hasParent(spillDir);
        assertThat(file.getFileName().toString()).startsWith(FileBuffer.PREFIX);

        buf.close();
        buf.close();

        assertThat(buf.isOpen()).isFalse();
        assertThat(Files.exists(file)).isFalse();
    }
}
