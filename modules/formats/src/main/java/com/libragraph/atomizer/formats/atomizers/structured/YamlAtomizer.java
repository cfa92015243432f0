package com.libragraph.atomizer.formats.atomizers.structured;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
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
 * YAML documents (first document of a stream).
 */
@ApplicationScoped
public class YamlAtomizer implements Atomizer {

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(25,
            Set.of("application/yaml", "application/x-yaml", "text/yaml", "text/x-yaml"),
            Set.of("yaml", "yml"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(YamlAtomizer.class.getSimpleName(), Modality.STRUCTURED);
    private final TreeAtomization tree = new TreeAtomization(new YAMLMapper(), "application/yaml");

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, tree::atomize);
    }
}
