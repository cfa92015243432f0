package com.libragraph.atomizer.formats.atomizers.media;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.types.Subtypes;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.libragraph.atomizer.formats.AtomizerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class AudioAtomizerTest {

    @Test
    void shouldSplitPcmIntoBuffersAndFrameAlignedChunks() {
        AudioAtomizer atomizer = new AudioAtomizer(10);

        AtomizationResult result = atomize(atomizer, "tone.wav", "audio/wav", MediaFixtures.wav(100));

        assertWellFormed(result);
        assertThat(result.processingInfo().detectedFormat()).isEqualTo("audio/wav");
        assertThat(result.atomsOfSubtype(Subtypes.AUDIO_BUFFER)).hasSize(2);
        assertThat(result.atomsOfSubtype(Subtypes.PCM_CHUNK))
                .hasSize(3)
                .allSatisfy(chunk -> assertThat(chunk.size() % 2).isZero());
        assertThat(childrenOf(result, result.rootHash()))
                .extracting(c -> c.position().x())
                .containsExactly(0.0, 80.0);
        assertThat(result.warnings()).isEmpty();
        assertThat(result.rootAtom().metadata()).contains("\"frames\":100");
    }

    @Test
    void shouldWarnOnTruncatedData() {
        byte[] wav = MediaFixtures.wav(100);
        byte[] truncated = Arrays.copyOf(wav, wav.length - 51);

        AtomizationResult result = atomize(new AudioAtomizer(10), "cut.wav", "audio/wav", truncated);

        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("truncated"));
    }

    @Test
    void shouldFallBackToEncodedChunksWithoutDecoder() {
        byte[] notPcm = "this is definitely not a pcm stream ".repeat(4).getBytes(StandardCharsets.US_ASCII);

        AtomizationResult result = atomize(new AudioAtomizer(), "song.mp3", "audio/mpeg", notPcm);

        assertThat(result.atomsOfSubtype(Subtypes.ENCODED_CHUNK)).isNotEmpty();
        assertThat(result.warnings()).singleElement().asString().contains("No PCM decoder");
        assertThat(reconstruct(result)).isEqualTo(notPcm);
    }

    @Test
    void shouldRejectNonPositiveBufferDuration() {
        assertThatThrownBy(() -> new AudioAtomizer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
