package com.libragraph.atomizer.formats.atomizers.media;

import com.libragraph.atomizer.formats.api.AtomizationException;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.enrich.EnrichmentServices;
import com.libragraph.atomizer.formats.enrich.FrameExtractor;
import com.libragraph.atomizer.formats.enrich.FrameExtractor.VideoFrame;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Video containers. MP4/QuickTime top-level boxes become {@code video-box} atoms; Matroska/WebM
 * and AVI are recognised by signature only. Frames come from an optional {@link FrameExtractor}
 * and are atomized by {@link ImageAtomizer}, each frame root composed under the video root at
 * {@code m = timestamp} with path {@code frame/<index>}.
 */
@ApplicationScoped
public class VideoAtomizer implements Atomizer {

    private static final Logger log = Logger.getLogger(VideoAtomizer.class);

    static final int MAX_FRAMES = 64;
    static final int MAX_BOXES = 4096;

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(30,
            Set.of("video/*"),
            Set.of("mp4", "m4v", "mov", "webm", "mkv", "avi"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(VideoAtomizer.class.getSimpleName(), Modality.VIDEO);
    private final ImageAtomizer imageAtomizer;
    private final EnrichmentServices enrichment;

    @Inject
    public VideoAtomizer(ImageAtomizer imageAtomizer, EnrichmentServices enrichment) {
        this.imageAtomizer = imageAtomizer;
        this.enrichment = enrichment;
    }

    public VideoAtomizer() {
        this(new ImageAtomizer(), EnrichmentServices.none());
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeVideo);
    }

    private FormatOutcome atomizeVideo(AtomizationContext ctx) throws IOException {
        AtomGraph.Builder graph = AtomGraph.builder();
        Map<String, Object> summary = new LinkedHashMap<>();
        byte[] header = ctx.content().readHeader(64);

        String container;
        if (isMp4(header)) {
            container = "video/mp4";
            summary.put("boxes", walkBoxes(ctx, graph));
        } else if (startsWith(header, 0, new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3})) {
            container = new String(header, StandardCharsets.ISO_8859_1).contains("webm") ? "video/webm" : "video/x-matroska";
        } else if (startsWith(header, 0, ascii("RIFF")) && startsWith(header, 8, ascii("AVI "))) {
            container = "video/x-msvideo";
        } else {
            container = ctx.source().contentType();
            graph.warn("Unrecognised video container in " + ctx.source().fileName());
        }
        summary.put("container", container);

        int frames = enrichment.frameExtractor()
                .map(extractor -> atomizeFrames(ctx, extractor, container, graph))
                .orElse(0);
        summary.put("frames", frames);
        return new FormatOutcome(container, summary, graph.build());
    }

    /**
     * Emits one {@code video-box} per top-level box: its header (and leading payload, up to 64 bytes),
     * positioned by byte offset with the box type as path.
     */
    private static int walkBoxes(AtomizationContext ctx, AtomGraph.Builder graph) throws IOException {
        long size = ctx.content().size();
        long offset = 0;
        int count = 0;
        while (offset + 8 <= size && count < MAX_BOXES) {
            ctx.checkCancelled();
            ByteBuffer head = ByteBuffer.wrap(ctx.content().readAt(offset, 16));
            long boxSize = Integer.toUnsignedLong(head.getInt(0));
            String type = new String(head.array(), 4, 4, StandardCharsets.ISO_8859_1);
            int headerSize = 8;
            if (boxSize == 1) {
                if (head.limit() < 16) {
                    graph.warn("Truncated 64-bit box header at offset " + offset);
                    break;
                }
                boxSize = head.getLong(8);
                headerSize = 16;
            } else if (boxSize == 0) {
                boxSize = size - offset;
            }
            if (boxSize < headerSize) {
                graph.warn("Invalid box size " + boxSize + " for '" + type + "' at offset " + offset);
                break;
            }
            boolean truncated = offset + boxSize > size;
            if (truncated) {
                graph.warn("Box '" + type + "' at offset " + offset + " extends past end of file");
            }

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("type", type);
            meta.put("offset", offset);
            meta.put("size", boxSize);
            if (truncated) meta.put("truncated", true);
            byte[] lead = ctx.content().readAt(offset, (int) Math.min(64, Math.min(boxSize, size - offset)));
            graph.addChild(ctx.rootHash(), Position.offset(offset).withPath(type), Modality.VIDEO, Subtypes.VIDEO_BOX,
                    lead, type, meta);
            count++;
            if (truncated) {
                break;
            }
            offset += boxSize;
        }
        return count;
    }

    private int atomizeFrames(AtomizationContext ctx, FrameExtractor extractor, String container,
                              AtomGraph.Builder graph) {
        List<VideoFrame> frames = enrichment
                .call("Frame extraction", () -> extractor.extractFrames(ctx.content(), container, MAX_FRAMES), graph)
                .orElse(List.of());
        int atomized = 0;
        for (VideoFrame frame : frames) {
            ctx.checkCancelled();
            String frameName = ctx.source().fileName() + "#frame-" + frame.index();
            try {
                AtomizationResult result = imageAtomizer.atomize(BinaryData.of(frame.image()),
                        ctx.source().forChild(frameName, frame.contentType(), frame.image().length),
                        ctx.cancellation());
                graph.merge(AtomGraph.of(result));
                graph.link(ctx.rootHash(), result.rootHash(),
                        Position.time(frame.timestampSeconds()).withPath("frame/" + frame.index()));
                atomized++;
            } catch (AtomizationException e) {
                log.debugf("Frame %d of %s failed: %s", frame.index(), ctx.source().fileName(), e.getMessage());
                graph.warn("Frame " + frame.index() + " of " + ctx.source().fileName() + " failed: " + e.getMessage());
            }
        }
        return atomized;
    }

    static boolean isMp4(byte[] header) {
        if (header.length < 8) {
            return false;
        }
        String type = new String(header, 4, 4, StandardCharsets.ISO_8859_1);
        return type.equals("ftyp") || type.equals("moov") || type.equals("mdat")
                || type.equals("wide") || type.equals("free") || type.equals("skip");
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (data.length < offset + prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
