package com.libragraph.atomizer.formats.atomizers.media;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.enrich.EnrichmentServices;
import com.libragraph.atomizer.formats.enrich.FrameExtractor;
import com.libragraph.atomizer.formats.enrich.FrameExtractor.VideoFrame;
import com.libragraph.atomizer.types.Subtypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static com.libragraph.atomizer.formats.AtomizerFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class VideoAtomizerTest {

    private static final byte[] MP4 = MediaFixtures.concat(
            MediaFixtures.box("ftyp", "isom\0\0\0\1".getBytes(StandardCharsets.ISO_8859_1)),
            MediaFixtures.box("moov", new byte[0]),
            MediaFixtures.box("mdat", new byte[]{1, 2, 3, 4}));

    private EnrichmentServices enrichment;

    @AfterEach
    void tearDown() {
        if (enrichment != null) enrichment.close();
    }

    @Test
    void shouldWalkTopLevelBoxes() {
        AtomizationResult result = atomize(new VideoAtomizer(), "clip.mp4", "video/mp4", MP4);

        assertWellFormed(result);
        assertThat(result.processingInfo().detectedFormat()).isEqualTo("video/mp4");
        assertThat(result.atomsOfSubtype(Subtypes.VIDEO_BOX)).extracting(Atom::canonicalText)
                .containsExactly("ftyp", "moov", "mdat");
        assertThat(childrenOf(result, result.rootHash())).extracting(c -> c.position().x())
                .containsExactly(0.0, 16.0, 24.0);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void shouldWarnOnBoxPastEndOfFile() {
        byte[] truncated = MediaFixtures.concat(MP4, new byte[]{0, 0, 1, 0, 'f', 'r', 'e', 'e'});

        AtomizationResult result = atomize(new VideoAtomizer(), "cut.mp4", "video/mp4", truncated);

        assertThat(result.atomsOfSubtype(Subtypes.VIDEO_BOX)).hasSize(4);
        assertThat(result.warnings()).singleElement().asString().contains("extends past end of file");
    }

    @Test
    void shouldAtomizeExtractedFramesAsImages() {
        byte[] frame = MediaFixtures.png(4, 4);
        FrameExtractor extractor = (video, contentType, maxFrames) -> List.of(
                new VideoFrame(0, 0.0, frame, "image/png"),
                new VideoFrame(1, 0.5, "garbage".getBytes(StandardCharsets.US_ASCII), "image/png"));
        enrichment = new EnrichmentServices(null, null, null, extractor, Duration.ofSeconds(5));

        AtomizationResult result = atomize(new VideoAtomizer(new ImageAtomizer(), enrichment), "clip.mp4", "video/mp4", MP4);

        assertWellFormed(result);
        AtomComposition frameEdge = childrenOf(result, result.rootHash()).stream()
                .filter(c -> "frame/0".equals(c.position().path()))
                .findFirst().orElseThrow();
        Atom frameRoot = atom(result, frameEdge.componentAtomHash());
        assertThat(frameRoot.subtype()).isEqualTo(Subtypes.FILE_METADATA);
        assertThat(result.atomsOfSubtype(Subtypes.PIXEL_BLOCK)).hasSize(1);
        assertThat(result.warnings()).singleElement().asString().contains("Frame 1");
        assertThat(result.rootAtom().metadata()).contains("\"frames\":1");
    }

    @Test
    void shouldWarnOnUnknownContainer() {
        AtomizationResult result = atomize(new VideoAtomizer(), "clip.mkv", "video/x-matroska",
                "definitely not a container".getBytes(StandardCharsets.US_ASCII));

        assertThat(result.warnings()).singleElement().asString().contains("Unrecognised video container");
    }
}
