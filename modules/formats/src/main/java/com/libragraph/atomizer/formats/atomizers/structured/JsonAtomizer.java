package com.libragraph.atomizer.formats.atomizers.structured;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Set;

/**
 * JSON documents, including {@code application/*+json} media types.
 * Syntax errors are structural failures.
 */
@ApplicationScoped
public class JsonAtomizer implements Atomizer {

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(25,
            Set.of("application/json", "text/json"),
            Set.of("json", "geojson", "jsonld"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(JsonAtomizer.class.getSimpleName(), Modality.STRUCTURED);
    private final TreeAtomization tree = new TreeAtomization(
            JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).build(),
            "application/json");

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public boolean canHandle(String contentType, String fileExtension) {
        if (contentType != null && DetectionCriteria.normalizeMime(contentType).endsWith("+json")) {
            return true;
        }
        return CRITERIA.matches(contentType, fileExtension);
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, tree::atomize);
    }
}
