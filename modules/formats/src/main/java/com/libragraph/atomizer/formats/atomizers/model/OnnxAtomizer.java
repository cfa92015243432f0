package com.libragraph.atomizer.formats.atomizers.model;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.atomizers.model.OnnxModelReader.Initializer;
import com.libragraph.atomizer.formats.atomizers.model.OnnxModelReader.Model;
import com.libragraph.atomizer.formats.atomizers.model.OnnxModelReader.Node;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * ONNX models: producer and opset information become {@code model-metadata} atoms, graph nodes
 * {@code onnx-node} atoms, initializers {@code tensor} atoms with {@code weight-chunk} children
 * taken from {@code raw_data} or packed {@code float_data}.
 */
@ApplicationScoped
public class OnnxAtomizer implements Atomizer {

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(60,
            Set.of("application/x-onnx", "application/onnx"), Set.of("onnx"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(OnnxAtomizer.class.getSimpleName(), Modality.MODEL);
    private final int maxChunksPerTensor;

    @Inject
    public OnnxAtomizer(@ConfigProperty(name = "atomizer.model.max-chunks-per-tensor", defaultValue = "65536")
                        int maxChunksPerTensor) {
        this.maxChunksPerTensor = maxChunksPerTensor;
    }

    public OnnxAtomizer() {
        this(65536);
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeOnnx);
    }

    private FormatOutcome atomizeOnnx(AtomizationContext ctx) throws IOException {
        Model model;
        try (InputStream in = ctx.content().inputStream(0)) {
            model = OnnxModelReader.read(in);
        }

        AtomGraph.Builder graph = AtomGraph.builder();
        TensorEmitter emitter = new TensorEmitter(ctx, graph, maxChunksPerTensor);

        emitter.metadata("ir_version", Long.toString(model.irVersion), Map.of());
        putIfPresent(emitter, "producer_name", model.producerName);
        putIfPresent(emitter, "producer_version", model.producerVersion);
        putIfPresent(emitter, "domain", model.domain);
        if (model.modelVersion != 0) {
            emitter.metadata("model_version", Long.toString(model.modelVersion), Map.of());
        }
        putIfPresent(emitter, "doc_string", model.docString);
        model.opsets.forEach((domain, version) ->
                emitter.metadata("opset." + domain, Long.toString(version), Map.of()));
        model.metadataProps.forEach((key, value) -> emitter.metadata(key, value, Map.of("property", true)));

        int index = 0;
        for (Node node : model.nodes) {
            ctx.checkCancelled();
            String label = node.opType() + ":" + (node.name().isEmpty() ? "#" + index : node.name());
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("opType", node.opType());
            if (!node.name().isEmpty()) meta.put("name", node.name());
            if (!node.domain().isEmpty()) meta.put("domain", node.domain());
            meta.put("inputs", node.inputs());
            meta.put("outputs", node.outputs());
            meta.put("index", index);
            graph.addChild(ctx.rootHash(), new Position(index, 0, 0, 0, "graph/node"), Modality.MODEL,
                    Subtypes.ONNX_NODE, label.getBytes(StandardCharsets.UTF_8), label, meta);
            index++;
        }

        long parameters = 0;
        for (Initializer init : model.initializers) {
            ctx.checkCancelled();
            long elements = 1;
            for (long d : init.dims()) {
                elements *= d;
            }
            parameters += elements;
            int elementSize = OnnxModelReader.elementSize(init.dataType());
            double elementsPerByte = elementSize == 0 ? 1.0 : 1.0 / elementSize;
            String type = OnnxModelReader.dataTypeName(init.dataType());
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("name", init.name());
            meta.put("dataType", type);
            meta.put("dims", init.dims());
            meta.put("elements", elements);
            String descriptor = init.name() + ":" + type + ":" + init.dims();
            if (init.external()) {
                meta.put("external", true);
                emitter.emit(init.name(), descriptor, meta, 0, 0, elementsPerByte);
            } else if (init.rawOffset() >= 0) {
                emitter.emit(init.name(), descriptor, meta, init.rawOffset(), init.rawLength(), elementsPerByte);
            } else if (init.floatData() != null) {
                emitter.emit(init.name(), descriptor, meta, BinaryData.of(init.floatData()), 0,
                        init.floatData().length, 0.25);
            } else {
                emitter.emit(init.name(), descriptor, meta, 0, 0, elementsPerByte);
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("irVersion", model.irVersion);
        if (model.producerName != null) summary.put("producer", model.producerName);
        if (model.graphName != null) summary.put("graph", model.graphName);
        summary.put("nodes", model.nodes.size());
        summary.put("initializers", model.initializers.size());
        summary.put("parameterCount", parameters);
        summary.put("weightChunks", emitter.totalChunks());
        return new FormatOutcome("application/x-onnx", summary, graph.build());
    }

    private static void putIfPresent(TensorEmitter emitter, String key, String value) {
        if (value != null && !value.isEmpty()) {
            emitter.metadata(key, value, Map.of());
        }
    }
}
