package com.libragraph.atomizer.formats.atomizers.text;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.DecodedText;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plain text: one {@code sentence} atom per sentence, in reading order.
 * Sentences keep their trailing whitespace, so the root's children concatenate back to the
 * original bytes (long sentences through their {@code chunk} children).
 */
@ApplicationScoped
public class TextAtomizer implements Atomizer {

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(10,
            Set.of("text/plain", "text/*"),
            Set.of("txt", "text", "log"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(TextAtomizer.class.getSimpleName(), Modality.TEXT);

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeText);
    }

    private FormatOutcome atomizeText(AtomizationContext ctx) {
        AtomGraph.Builder graph = AtomGraph.builder();
        DecodedText decoded = DecodedText.decode(ctx.content().toByteArray());
        if (decoded.fallback()) {
            graph.warn(decoded.fallbackWarning(ctx.source().fileName()));
        }

        List<SentenceSegmenter.Segment> sentences = SentenceSegmenter.segment(decoded.text());
        for (int i = 0; i < sentences.size(); i++) {
            if (i % 256 == 0) {
                ctx.checkCancelled();
            }
            SentenceSegmenter.Segment s = sentences.get(i);
            graph.addChild(ctx.rootHash(), Position.offset(s.start()), Modality.TEXT, Subtypes.SENTENCE,
                    decoded.encode(s.start(), s.end()), s.of(decoded.text()).strip(), null);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("encoding", decoded.charset().name());
        summary.put("characters", decoded.text().length());
        summary.put("sentences", sentences.size());
        return new FormatOutcome("text/plain", summary, graph.build());
    }
}
