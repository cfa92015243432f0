package com.libragraph.atomizer.formats.codecs;

import com.libragraph.atomizer.formats.api.ResourceLimitExceededException;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.util.buffer.BinaryData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.*;

class GzipCodecTest {
    private GzipCodec codec;

    @BeforeEach
    void setUp() {
        codec = new GzipCodec();
    }

    @Test
    void shouldMatchGzipMagicBytes() {
        byte[] gzipHeader = new byte[]{0x1f, (byte) 0x8b, 0x08, 0x00};
        assertThat(codec.matches(gzipHeader, "unknown")).isTrue();
    }

    @Test
    void shouldMatchGzipExtension() {
        byte[] unknownHeader = new byte[]{0x00, 0x00};
        assertThat(codec.matches(unknownHeader, "file.gz")).isTrue();
        assertThat(codec.matches(unknownHeader, "file.gzip")).isTrue();
        assertThat(codec.matches(unknownHeader, "archive.tgz")).isTrue();
    }

    @Test
    void shouldNotMatchNonGzipFile() {
        assertThat(codec.matches("Hello".getBytes(), "file.txt")).isFalse();
    }

    @Test
    void shouldDecompress() throws Exception {
        String original = "Hello, World! ".repeat(100);

        try (BinaryData decoded = codec.decode(BinaryData.of(gzip(original)), 1 << 20)) {
            assertThat(new String(decoded.toByteArray(), StandardCharsets.UTF_8)).isEqualTo(original);
        }
    }

    @Test
    void shouldStopAtSizeLimit() throws Exception {
        byte[] bomb = gzip("A".repeat(100_000));

        assertThatThrownBy(() -> codec.decode(BinaryData.of(bomb), 1000))
                .isInstanceOf(ResourceLimitExceededException.class)
                .hasMessageContaining("> 1000");
    }

    @Test
    void shouldReportCorruptStreamAsStructural() {
        byte[] corrupt = {0x1f, (byte) 0x8b, 0x08, 0x00, 1, 2, 3};

        assertThatThrownBy(() -> codec.decode(BinaryData.of(corrupt), 1000))
                .isInstanceOf(StructuralParseException.class);
    }

    @Test
    void shouldStripExtension() {
        assertThat(codec.decodedName("notes.txt.gz")).isEqualTo("notes.txt");
        assertThat(codec.decodedName("bundle.tgz")).isEqualTo("bundle.tar");
        assertThat(codec.decodedName("plain")).isEqualTo("plain");
    }

    static byte[] gzip(String text) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
