package com.libragraph.atomizer;

import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.Codec;
import com.libragraph.atomizer.formats.atomizers.archive.ArchiveAtomizer;
import com.libragraph.atomizer.formats.atomizers.binary.BinaryAtomizer;
import com.libragraph.atomizer.formats.atomizers.media.ImageAtomizer;
import com.libragraph.atomizer.formats.atomizers.model.GgufAtomizer;
import com.libragraph.atomizer.formats.atomizers.text.MarkdownAtomizer;
import com.libragraph.atomizer.formats.registry.AtomizerRegistry;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * CDI integration test verifying that AtomizerRegistry discovers every
 * Atomizer and Codec bean via Quarkus/ArC.
 */
@QuarkusTest
class AtomizerRegistryTest {

    @Inject
    AtomizerRegistry registry;

    @Inject
    Instance<Codec> codecs;

    @Test
    void shouldDiscoverAllAtomizers() {
        assertThat(registry.atomizers())
                .extracting(Atomizer::name)
                .contains("TextAtomizer", "MarkdownAtomizer", "CodeAtomizer", "JsonAtomizer", "XmlAtomizer",
                        "YamlAtomizer", "ImageAtomizer", "AudioAtomizer", "VideoAtomizer", "DocumentAtomizer",
                        "ArchiveAtomizer", "GgufAtomizer", "SafeTensorsAtomizer", "OnnxAtomizer",
                        "ModelFileAtomizer", "BinaryAtomizer")
                .doesNotHaveDuplicates();
    }

    @Test
    void shouldDiscoverAllCodecs() {
        long count = StreamSupport.stream(codecs.spliterator(), false).count();

        // Gzip, Bzip2
        assertThat(count).isGreaterThanOrEqualTo(2);
    }

    @Test
    void shouldSelectByDeclaredType() {
        assertThat(registry.find("text/markdown", "md")).get().isInstanceOf(MarkdownAtomizer.class);
        assertThat(registry.find("image/png", "png")).get().isInstanceOf(ImageAtomizer.class);
        assertThat(registry.find("application/zip", "zip")).get().isInstanceOf(ArchiveAtomizer.class);
    }

    @Test
    void shouldSelectByMagicBytes() {
        byte[] header = "GGUF\3\0\0\0".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(registry.find("application/octet-stream", null, header)).get().isInstanceOf(GgufAtomizer.class);
    }

    @Test
    void shouldFallBackToBinary() {
        assertThat(registry.find("application/x-unknown", "xyz")).get().isInstanceOf(BinaryAtomizer.class);
    }
}
