package com.libragraph.atomizer.formats.atomizers.binary;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Map;

/**
 * Fallback for anything no other atomizer claims: 64-byte {@code byte-chunk} atoms positioned
 * by byte offset. Never fails on content.
 */
@ApplicationScoped
public class BinaryAtomizer implements Atomizer {

    static final int CANCELLATION_INTERVAL = 4096;

    private static final DetectionCriteria CRITERIA = DetectionCriteria.catchAll(0);

    private final AtomizerPipeline pipeline = new AtomizerPipeline(BinaryAtomizer.class.getSimpleName(), Modality.BINARY);

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, BinaryAtomizer::chunk);
    }

    private static FormatOutcome chunk(AtomizationContext ctx) throws IOException {
        AtomGraph.Builder graph = AtomGraph.builder();
        byte[] buffer = new byte[Atom.MAX_SIZE];
        long offset = 0;
        long chunks = 0;
        try (InputStream in = ctx.content().inputStream(0)) {
            int read;
            while ((read = in.readNBytes(buffer, 0, buffer.length)) > 0) {
                if (chunks % CANCELLATION_INTERVAL == 0) {
                    ctx.checkCancelled();
                }
                graph.addChild(ctx.rootHash(), Position.offset(offset), Modality.BINARY, Subtypes.BYTE_CHUNK,
                        Arrays.copyOf(buffer, read), null, null);
                offset += read;
                chunks++;
            }
        }
        return new FormatOutcome(ctx.source().contentType(), Map.of("chunks", chunks), graph.build());
    }
}
