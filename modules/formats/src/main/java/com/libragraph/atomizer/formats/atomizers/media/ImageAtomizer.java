package com.libragraph.atomizer.formats.atomizers.media;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.enrich.EnrichmentServices;
import com.libragraph.atomizer.formats.enrich.ObjectDetectionService.DetectedObject;
import com.libragraph.atomizer.formats.enrich.SceneAnalysisService.SceneDescription;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raster images cut into 4x4 RGBA {@code pixel-block} atoms (64 bytes each, smaller at the
 * right and bottom edges), positioned {@code (x, y, layer, frame)} in pixels. Every frame of
 * animated images is walked.
 *
 * <p>The container signature is mandatory. A well-signed image ImageIO cannot decode is cut into
 * 64-byte blocks of its encoded stream instead, recorded as {@code decoded=false}.
 * OCR, object detection and scene analysis run when the collaborators exist; their failures are
 * warnings.
 */
@ApplicationScoped
public class ImageAtomizer implements Atomizer {

    private static final Logger log = Logger.getLogger(ImageAtomizer.class);

    static final int BLOCK = 4;
    static final int MAX_FRAMES = 256;

    private static final DetectionCriteria CRITERIA = new DetectionCriteria(
            Set.of("image/*"),
            Set.of("png", "jpg", "jpeg", "gif", "bmp", "tif", "tiff", "webp"),
            new byte[]{(byte) 0x89, 'P', 'N', 'G'}, 0, 20);

    private final AtomizerPipeline pipeline = new AtomizerPipeline(ImageAtomizer.class.getSimpleName(), Modality.IMAGE);
    private final EnrichmentServices enrichment;

    @Inject
    public ImageAtomizer(EnrichmentServices enrichment) {
        this.enrichment = enrichment;
    }

    public ImageAtomizer() {
        this(EnrichmentServices.none());
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public boolean canHandle(String contentType, String fileExtension) {
        if ("svg".equals(DetectionCriteria.normalizeExtension(fileExtension))
                || (contentType != null && DetectionCriteria.normalizeMime(contentType).startsWith("image/svg"))) {
            return false;
        }
        return CRITERIA.matches(contentType, fileExtension);
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeImage);
    }

    private FormatOutcome atomizeImage(AtomizationContext ctx) {
        byte[] bytes = ctx.content().toByteArray();
        ImageSignature signature = ImageSignature.detect(bytes)
                .orElseThrow(() -> new StructuralParseException(
                        "Invalid image header in " + ctx.source().fileName()));

        AtomGraph.Builder graph = AtomGraph.builder();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("format", signature.mimeType());

        int frames = decodeFrames(ctx, bytes, graph, summary);
        if (frames == 0) {
            summary.put("decoded", false);
            encodedBlocks(ctx, bytes, graph);
        } else {
            summary.put("decoded", true);
            summary.put("frames", frames);
        }

        enrich(ctx, bytes, signature.mimeType(), graph);
        return new FormatOutcome(signature.mimeType(), summary, graph.build());
    }

    /**
     * Appends the pixel blocks of every frame under {@code ctx.rootHash()}.
     *
     * @return number of frames decoded; 0 when the first frame could not be read
     */
    int decodeFrames(AtomizationContext ctx, byte[] bytes, AtomGraph.Builder graph, Map<String, Object> summary) {
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = iis == null ? null : ImageIO.getImageReaders(iis);
            if (readers == null || !readers.hasNext()) {
                return 0;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis);
                int decoded = 0;
                for (int frame = 0; frame < MAX_FRAMES; frame++) {
                    BufferedImage image;
                    try {
                        image = reader.read(frame);
                    } catch (IndexOutOfBoundsException e) {
                        break;
                    } catch (IOException | RuntimeException e) {
                        if (frame == 0) {
                            log.debugf("ImageIO could not decode %s: %s", ctx.source().fileName(), e.getMessage());
                            return 0;
                        }
                        graph.warn("Frame " + frame + " of " + ctx.source().fileName() + " is unreadable: " + e.getMessage());
                        break;
                    }
                    if (frame == 0) {
                        summary.put("width", image.getWidth());
                        summary.put("height", image.getHeight());
                    }
                    pixelBlocks(ctx, image, frame, graph);
                    decoded++;
                }
                return decoded;
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.debugf("ImageIO could not open %s: %s", ctx.source().fileName(), e.getMessage());
            return 0;
        }
    }

    /**
     * Cuts one frame into 4x4 RGBA blocks composed into {@code ctx.rootHash()} row by row.
     */
    static void pixelBlocks(AtomizationContext ctx, BufferedImage image, int frame, AtomGraph.Builder graph) {
        int width = image.getWidth();
        int height = image.getHeight();
        for (int by = 0; by < height; by += BLOCK) {
            ctx.checkCancelled();
            for (int bx = 0; bx < width; bx += BLOCK) {
                int w = Math.min(BLOCK, width - bx);
                int h = Math.min(BLOCK, height - by);
                byte[] rgba = new byte[w * h * 4];
                int i = 0;
                for (int y = by; y < by + h; y++) {
                    for (int x = bx; x < bx + w; x++) {
                        int argb = image.getRGB(x, y);
                        rgba[i++] = (byte) (argb >> 16);
                        rgba[i++] = (byte) (argb >> 8);
                        rgba[i++] = (byte) argb;
                        rgba[i++] = (byte) (argb >>> 24);
                    }
                }
                graph.addChild(ctx.rootHash(), Position.pixel(bx, by, 0, frame), Modality.IMAGE,
                        Subtypes.PIXEL_BLOCK, rgba, null, null);
            }
        }
    }

    private static void encodedBlocks(AtomizationContext ctx, byte[] bytes, AtomGraph.Builder graph) {
        for (int offset = 0; offset < bytes.length; offset += Atom.MAX_SIZE) {
            if (offset % (Atom.MAX_SIZE * 4096) == 0) {
                ctx.checkCancelled();
            }
            byte[] block = Arrays.copyOfRange(bytes, offset, Math.min(bytes.length, offset + Atom.MAX_SIZE));
            graph.addChild(ctx.rootHash(), Position.offset(offset), Modality.IMAGE, Subtypes.PIXEL_BLOCK,
                    block, null, null);
        }
    }

    private void enrich(AtomizationContext ctx, byte[] bytes, String contentType, AtomGraph.Builder graph) {
        ContentHash root = ctx.rootHash();

        enrichment.ocr().ifPresent(ocr -> enrichment.call("OCR", () -> ocr.recognize(bytes, contentType), graph)
                .filter(result -> result.text() != null && !result.text().isBlank())
                .ifPresent(result -> graph.addChild(root, Position.path("ocr"), Modality.TEXT, Subtypes.OCR_TEXT,
                        result.text().getBytes(StandardCharsets.UTF_8), result.text(),
                        Map.of("confidence", result.confidence()))));

        enrichment.objectDetection().ifPresent(detector ->
                enrichment.call("Object detection", () -> detector.detect(bytes, contentType), graph)
                        .ifPresent(objects -> addDetections(root, objects, graph)));

        enrichment.sceneAnalysis().ifPresent(scene ->
                enrichment.call("Scene analysis", () -> scene.describe(bytes, contentType), graph)
                        .ifPresent(description -> addScene(root, description, graph)));
    }

    private static void addDetections(ContentHash root, List<DetectedObject> objects, AtomGraph.Builder graph) {
        for (DetectedObject o : objects) {
            String label = o.label() + "@" + o.x() + "," + o.y() + "," + o.width() + "x" + o.height();
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("label", o.label());
            meta.put("confidence", o.confidence());
            meta.put("box", List.of(o.x(), o.y(), o.width(), o.height()));
            graph.addChild(root, Position.pixel(o.x(), o.y(), 0, 0).withPath("object"), Modality.IMAGE,
                    Subtypes.DETECTED_OBJECT, label.getBytes(StandardCharsets.UTF_8), o.label(), meta);
        }
    }

    private static void addScene(ContentHash root, SceneDescription description, AtomGraph.Builder graph) {
        if (description.caption() == null || description.caption().isBlank()) {
            return;
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("tags", description.tags());
        meta.put("confidence", description.confidence());
        graph.addChild(root, Position.path("scene"), Modality.TEXT, Subtypes.SCENE_ANALYSIS,
                description.caption().getBytes(StandardCharsets.UTF_8), description.caption(), meta);
    }
}
