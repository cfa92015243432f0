package com.libragraph.atomizer.formats.atomizers.media;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.enrich.EnrichmentServices;
import com.libragraph.atomizer.formats.enrich.ObjectDetectionService;
import com.libragraph.atomizer.formats.enrich.OcrService;
import com.libragraph.atomizer.types.Subtypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static com.libragraph.atomizer.formats.AtomizerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ImageAtomizerTest {

    private EnrichmentServices enrichment;

    @AfterEach
    void tearDown() {
        if (enrichment != null) enrichment.close();
    }

    @Test
    void shouldHandleRasterImagesButNotSvg() {
        ImageAtomizer atomizer = new ImageAtomizer();

        assertThat(atomizer.canHandle("image/png", "png")).isTrue();
        assertThat(atomizer.canHandle("image/svg+xml", "svg")).isFalse();
    }

    @Test
    void shouldCutDecodedImageIntoPixelBlocks() {
        AtomizationResult result = atomize(new ImageAtomizer(), "tile.png", "image/png", MediaFixtures.png(8, 8));

        assertWellFormed(result);
        assertThat(result.atomsOfSubtype(Subtypes.PIXEL_BLOCK))
                .hasSize(4)
                .allSatisfy(block -> assertThat(block.size()).isEqualTo(Atom.MAX_SIZE));
        assertThat(childrenOf(result, result.rootHash()))
                .extracting(AtomComposition::position)
                .extracting(p -> (int) p.x() + "," + (int) p.y())
                .containsExactly("0,0", "4,0", "0,4", "4,4");
        assertThat(result.rootAtom().metadata()).contains("\"decoded\":true").contains("\"width\":8");
    }

    @Test
    void shouldKeepPartialEdgeBlocks() {
        AtomizationResult result = atomize(new ImageAtomizer(), "odd.png", "image/png", MediaFixtures.png(5, 3));

        assertThat(result.atomsOfSubtype(Subtypes.PIXEL_BLOCK))
                .extracting(Atom::size)
                .containsExactlyInAnyOrder(4 * 3 * 4, 1 * 3 * 4);
    }

    @Test
    void shouldRejectInvalidSignature() {
        assertThatThrownBy(() -> atomize(new ImageAtomizer(), "fake.png", "image/png", "not an image".getBytes()))
                .isInstanceOf(StructuralParseException.class);
    }

    @Test
    void shouldFallBackToEncodedBlocksWhenUndecodable() {
        byte[] png = MediaFixtures.png(8, 8);
        byte[] broken = Arrays.copyOf(png, 40);

        AtomizationResult result = atomize(new ImageAtomizer(), "broken.png", "image/png", broken);

        assertThat(result.atomsOfSubtype(Subtypes.PIXEL_BLOCK)).hasSize(1);
        assertThat(result.rootAtom().metadata()).contains("\"decoded\":false");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void shouldAddOcrAndTurnDetectorFailureIntoWarning() {
        OcrService ocr = (image, contentType) -> new OcrService.OcrResult("STOP", 0.9);
        ObjectDetectionService detector = (image, contentType) -> {
            throw new IllegalStateException("model not loaded");
        };
        enrichment = new EnrichmentServices(ocr, detector, null, null, Duration.ofSeconds(5));

        AtomizationResult result = atomize(new ImageAtomizer(enrichment), "sign.png", "image/png", MediaFixtures.png(4, 4));

        assertThat(result.atomsOfSubtype(Subtypes.OCR_TEXT)).singleElement()
                .satisfies(a -> assertThat(a.canonicalText()).isEqualTo("STOP"));
        assertThat(result.warnings()).singleElement().asString()
                .contains("Object detection failed").contains("model not loaded");
    }

    @Test
    void shouldWarnOnEnrichmentTimeout() {
        OcrService slow = (image, contentType) -> {
            Thread.sleep(5_000);
            return new OcrService.OcrResult("late", 1.0);
        };
        enrichment = new EnrichmentServices(slow, null, null, null, Duration.ofMillis(50));

        AtomizationResult result = atomize(new ImageAtomizer(enrichment), "slow.png", "image/png", MediaFixtures.png(4, 4));

        assertThat(result.atomsOfSubtype(Subtypes.OCR_TEXT)).isEmpty();
        assertThat(result.warnings()).singleElement().asString().contains("timed out");
    }
}
