package com.libragraph.atomizer.formats.atomizers.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.DetectionCriteria;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.AtomizerPipeline;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SafeTensors files: 8-byte little-endian header length, a JSON header mapping tensor names to
 * {@code dtype}, {@code shape} and {@code data_offsets}, then the raw tensor bytes.
 * {@code __metadata__} entries become {@code model-metadata} atoms.
 */
@ApplicationScoped
public class SafeTensorsAtomizer implements Atomizer {

    static final long MAX_HEADER_BYTES = 100L * 1024 * 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<String, Integer> DTYPE_SIZES = Map.ofEntries(
            Map.entry("F64", 8), Map.entry("F32", 4), Map.entry("F16", 2), Map.entry("BF16", 2),
            Map.entry("F8_E4M3", 1), Map.entry("F8_E5M2", 1),
            Map.entry("I64", 8), Map.entry("I32", 4), Map.entry("I16", 2), Map.entry("I8", 1),
            Map.entry("U64", 8), Map.entry("U32", 4), Map.entry("U16", 2), Map.entry("U8", 1),
            Map.entry("BOOL", 1));

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(60,
            Set.of("application/x-safetensors"), Set.of("safetensors"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(SafeTensorsAtomizer.class.getSimpleName(), Modality.MODEL);
    private final int maxChunksPerTensor;

    @Inject
    public SafeTensorsAtomizer(@ConfigProperty(name = "atomizer.model.max-chunks-per-tensor", defaultValue = "65536")
                               int maxChunksPerTensor) {
        this.maxChunksPerTensor = maxChunksPerTensor;
    }

    public SafeTensorsAtomizer() {
        this(65536);
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeSafeTensors);
    }

    private record Entry(String name, String dtype, long[] shape, long begin, long end) {
    }

    private FormatOutcome atomizeSafeTensors(AtomizationContext ctx) throws IOException {
        BinaryData content = ctx.content();
        if (content.size() < 8) {
            throw new StructuralParseException("SafeTensors file " + ctx.source().fileName() + " has no header length");
        }
        long headerLength = ByteBuffer.wrap(content.readAt(0, 8)).order(ByteOrder.LITTLE_ENDIAN).getLong();
        if (headerLength <= 0 || headerLength > MAX_HEADER_BYTES || headerLength > content.size() - 8) {
            throw new StructuralParseException("Invalid SafeTensors header length " + headerLength);
        }
        JsonNode header;
        try {
            header = MAPPER.readTree(new String(content.readAt(8, (int) headerLength), StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new StructuralParseException("SafeTensors header is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (header == null || !header.isObject()) {
            throw new StructuralParseException("SafeTensors header is not a JSON object");
        }

        AtomGraph.Builder graph = AtomGraph.builder();
        TensorEmitter emitter = new TensorEmitter(ctx, graph, maxChunksPerTensor);
        long dataStart = 8 + headerLength;

        JsonNode declared = header.get("__metadata__");
        if (declared != null && declared.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = declared.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                emitter.metadata(field.getKey(), value.isTextual() ? value.asText() : value.toString(), Map.of());
            }
        }

        List<Entry> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = header.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!"__metadata__".equals(field.getKey())) {
                entries.add(entry(field.getKey(), field.getValue()));
            }
        }
        entries.sort(Comparator.comparingLong(Entry::begin));

        long parameters = 0;
        for (Entry entry : entries) {
            ctx.checkCancelled();
            int dtypeSize = DTYPE_SIZES.get(entry.dtype());
            long elements = 1;
            long expectedBytes;
            long dataOffset;
            try {
                for (long d : entry.shape()) {
                    elements = Math.multiplyExact(elements, d);
                }
                expectedBytes = Math.multiplyExact(elements, (long) dtypeSize);
                dataOffset = Math.addExact(dataStart, entry.begin());
            } catch (ArithmeticException e) {
                throw new StructuralParseException("Tensor " + entry.name() + " size or offset overflows", e);
            }
            parameters += elements;
            long byteLength = entry.end() - entry.begin();
            if (byteLength != expectedBytes) {
                graph.warn("Tensor " + entry.name() + " spans " + byteLength + " bytes but its shape needs "
                        + expectedBytes);
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("name", entry.name());
            meta.put("dtype", entry.dtype());
            meta.put("shape", entry.shape());
            meta.put("elements", elements);
            meta.put("offset", entry.begin());
            String descriptor = entry.name() + ":" + entry.dtype() + ":" + Arrays.toString(entry.shape());
            emitter.emit(entry.name(), descriptor, meta, dataOffset, byteLength, 1.0 / dtypeSize);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("headerBytes", headerLength);
        summary.put("tensorCount", entries.size());
        summary.put("parameterCount", parameters);
        summary.put("weightChunks", emitter.totalChunks());
        return new FormatOutcome("application/x-safetensors", summary, graph.build());
    }

    private static Entry entry(String name, JsonNode node) {
        JsonNode dtype = node.get("dtype");
        JsonNode shape = node.get("shape");
        JsonNode offsets = node.get("data_offsets");
        if (dtype == null || !dtype.isTextual() || shape == null || !shape.isArray()
                || offsets == null || !offsets.isArray() || offsets.size() != 2) {
            throw new StructuralParseException("Malformed SafeTensors entry " + name);
        }
        if (!DTYPE_SIZES.containsKey(dtype.asText())) {
            throw new StructuralParseException("Unknown dtype " + dtype.asText() + " for tensor " + name);
        }
        long[] dims = new long[shape.size()];
        for (int i = 0; i < dims.length; i++) {
            if (!shape.get(i).canConvertToLong() || shape.get(i).asLong() < 0) {
                throw new StructuralParseException("Invalid shape for tensor " + name);
            }
            dims[i] = shape.get(i).asLong();
        }
        long begin = offsets.get(0).asLong(-1);
        long end = offsets.get(1).asLong(-1);
        if (begin < 0 || end < begin) {
            throw new StructuralParseException("Invalid data_offsets for tensor " + name);
        }
        return new Entry(name, dtype.asText(), dims, begin, end);
    }
}
