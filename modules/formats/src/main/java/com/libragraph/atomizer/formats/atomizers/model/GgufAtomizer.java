package com.libragraph.atomizer.formats.atomizers.model;

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
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * GGUF (versions 1 to 3) model files: every header key/value becomes a {@code model-metadata}
 * atom, every tensor a {@code tensor} atom with {@code weight-chunk} children.
 *
 * <p>Layout: magic {@code GGUF}, version, tensor count, key/value count, typed key/values,
 * tensor infos (name, dimensions, ggml type, offset relative to the data section), padding to
 * {@code general.alignment}, tensor data. Version 1 files use 32-bit counts and string lengths.
 */
@ApplicationScoped
public class GgufAtomizer implements Atomizer {

    private static final Logger log = Logger.getLogger(GgufAtomizer.class);

    static final byte[] MAGIC = {'G', 'G', 'U', 'F'};
    static final int DEFAULT_ALIGNMENT = 32;
    static final int MAX_DIMENSIONS = 8;
    private static final int MAX_NESTING = 4;
    private static final int RENDERED_ARRAY_ITEMS = 16;

    private static final DetectionCriteria CRITERIA = new DetectionCriteria(
            Set.of("application/x-gguf"), Set.of("gguf"), MAGIC, 0, 60);

    private final AtomizerPipeline pipeline = new AtomizerPipeline(GgufAtomizer.class.getSimpleName(), Modality.MODEL);
    private final int maxChunksPerTensor;

    @Inject
    public GgufAtomizer(@ConfigProperty(name = "atomizer.model.max-chunks-per-tensor", defaultValue = "65536")
                        int maxChunksPerTensor) {
        this.maxChunksPerTensor = maxChunksPerTensor;
    }

    public GgufAtomizer() {
        this(65536);
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeGguf);
    }

    private record TensorInfo(String name, long[] dimensions, GgmlType type, long offset) {
        long elements() {
            long count = 1;
            for (long d : dimensions) {
                count = Math.multiplyExact(count, d);
            }
            return count;
        }

        String descriptor() {
            return name + ":" + type + ":" + Arrays.toString(dimensions);
        }
    }

    private FormatOutcome atomizeGguf(AtomizationContext ctx) throws IOException {
        byte[] magic = ctx.content().readHeader(MAGIC.length);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new StructuralParseException("Invalid GGUF magic in " + ctx.source().fileName() + ": "
                    + new String(magic, StandardCharsets.ISO_8859_1));
        }

        AtomGraph.Builder graph = AtomGraph.builder();
        TensorEmitter emitter = new TensorEmitter(ctx, graph, maxChunksPerTensor);
        Map<String, Object> kv = new LinkedHashMap<>();
        List<TensorInfo> tensors = new ArrayList<>();
        int version;
        long dataStart;
        int alignment;

        try (LittleEndianInput in = new LittleEndianInput(ctx.content().inputStream(0), ctx.content().size())) {
            in.skip(MAGIC.length);
            version = in.i32();
            if (version < 1 || version > 3) {
                throw new StructuralParseException("Unsupported GGUF version " + version);
            }
            boolean wide = version >= 2;
            long tensorCount = count(in, wide, "tensor count");
            long kvCount = count(in, wide, "key/value count");

            for (long i = 0; i < kvCount; i++) {
                ctx.checkCancelled();
                String key = string(in, wide);
                int valueType = in.i32();
                Object value = value(in, valueType, wide, 0);
                kv.put(key, value);
                Map<String, Object> extra = new LinkedHashMap<>();
                extra.put("type", typeName(valueType));
                if (value instanceof List<?> list) {
                    extra.put("length", list.size());
                }
                emitter.metadata(key, render(value), extra);
            }

            for (long i = 0; i < tensorCount; i++) {
                ctx.checkCancelled();
                String name = string(in, wide);
                long nDims = in.u32();
                if (nDims > MAX_DIMENSIONS) {
                    throw new StructuralParseException("Tensor " + name + " declares " + nDims + " dimensions");
                }
                long[] dims = new long[(int) nDims];
                for (int d = 0; d < nDims; d++) {
                    dims[d] = wide ? in.i64() : in.u32();
                    if (dims[d] < 0) {
                        throw new StructuralParseException("Tensor " + name + " has negative dimension");
                    }
                }
                int typeId = in.i32();
                GgmlType type = GgmlType.fromId(typeId);
                if (type == null) {
                    throw new StructuralParseException("Tensor " + name + " has unknown ggml type " + typeId);
                }
                long offset = in.i64();
                tensors.add(new TensorInfo(name, dims, type, offset));
            }

            alignment = alignment(kv, graph);
            long headerEnd = in.position();
            dataStart = headerEnd % alignment == 0 ? headerEnd : headerEnd + alignment - headerEnd % alignment;
        }

        long parameters = 0;
        for (TensorInfo tensor : tensors) {
            ctx.checkCancelled();
            if (tensor.offset() < 0) {
                throw new StructuralParseException("Tensor " + tensor.name() + " has offset "
                        + Long.toUnsignedString(tensor.offset()) + " beyond the addressable range");
            }
            long elements;
            long byteLength;
            long dataOffset;
            try {
                elements = tensor.elements();
                byteLength = tensor.type().byteLength(elements);
                dataOffset = Math.addExact(dataStart, tensor.offset());
            } catch (ArithmeticException e) {
                throw new StructuralParseException("Tensor " + tensor.name() + " size or offset overflows", e);
            }
            parameters += elements;
            if (tensor.offset() % alignment != 0) {
                graph.warn("Tensor " + tensor.name() + " offset " + tensor.offset() + " is not aligned to " + alignment);
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("name", tensor.name());
            meta.put("type", tensor.type().name());
            meta.put("dimensions", tensor.dimensions());
            meta.put("elements", elements);
            meta.put("offset", tensor.offset());
            emitter.emit(tensor.name(), tensor.descriptor(), meta,
                    dataOffset, byteLength, tensor.type().elementsPerByte());
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("version", version);
        summary.put("tensorCount", tensors.size());
        summary.put("metadataCount", kv.size());
        summary.put("alignment", alignment);
        if (kv.get("general.architecture") instanceof String architecture) {
            summary.put("architecture", architecture);
        }
        if (kv.get("general.file_type") instanceof Number fileType) {
            summary.put("fileType", fileTypeName(fileType.intValue()));
        }
        summary.put("parameterCount", parameters);
        summary.put("weightChunks", emitter.totalChunks());
        log.debugf("GGUF v%d %s: %d tensors, %d parameters", version, ctx.source().fileName(), tensors.size(), parameters);
        return new FormatOutcome("application/x-gguf", summary, graph.build());
    }

    private static long count(LittleEndianInput in, boolean wide, String what) throws IOException {
        long value = wide ? in.i64() : in.u32();
        // every entry takes at least 8 bytes
        if (value < 0 || value > in.remaining() / 8 + 1) {
            throw new StructuralParseException("Implausible GGUF " + what + ": " + Long.toUnsignedString(value));
        }
        return value;
    }

    private static String string(LittleEndianInput in, boolean wide) throws IOException {
        long length = wide ? in.i64() : in.u32();
        return in.utf8(in.length(length, "string"));
    }

    private static Object value(LittleEndianInput in, int type, boolean wide, int depth) throws IOException {
        return switch (type) {
            case 0 -> in.u8();
            case 1 -> (byte) in.u8();
            case 2 -> in.i16() & 0xFFFF;
            case 3 -> in.i16();
            case 4 -> in.u32();
            case 5 -> in.i32();
            case 6 -> in.f32();
            case 7 -> in.u8() != 0;
            case 8 -> string(in, wide);
            case 9 -> array(in, wide, depth);
            case 10, 11 -> in.i64();
            case 12 -> in.f64();
            default -> throw new StructuralParseException("Unknown GGUF value type " + type);
        };
    }

    private static List<Object> array(LittleEndianInput in, boolean wide, int depth) throws IOException {
        if (depth >= MAX_NESTING) {
            throw new StructuralParseException("GGUF arrays nested deeper than " + MAX_NESTING);
        }
        int elementType = in.i32();
        long length = wide ? in.i64() : in.u32();
        int count = in.length(length, "array");
        List<Object> values = new ArrayList<>(Math.min(count, 1 << 16));
        for (int i = 0; i < count; i++) {
            values.add(value(in, elementType, wide, depth + 1));
        }
        return values;
    }

    private static int alignment(Map<String, Object> kv, AtomGraph.Builder graph) {
        Object declared = kv.get("general.alignment");
        if (declared == null) {
            return DEFAULT_ALIGNMENT;
        }
        if (declared instanceof Number number) {
            long value = number.longValue();
            if (value > 0 && value <= (1 << 20) && Long.bitCount(value) == 1) {
                return (int) value;
            }
        }
        graph.warn("Ignoring invalid general.alignment " + declared + "; using " + DEFAULT_ALIGNMENT);
        return DEFAULT_ALIGNMENT;
    }

    static String render(Object value) {
        if (value instanceof List<?> list) {
            if (list.size() <= RENDERED_ARRAY_ITEMS) {
                return list.stream().map(GgufAtomizer::render).collect(Collectors.joining(",", "[", "]"));
            }
            return list.subList(0, RENDERED_ARRAY_ITEMS / 2).stream().map(GgufAtomizer::render)
                    .collect(Collectors.joining(",", "[", ",... " + list.size() + " items]"));
        }
        return String.valueOf(value);
    }

    private static String typeName(int type) {
        return switch (type) {
            case 0 -> "uint8";
            case 1 -> "int8";
            case 2 -> "uint16";
            case 3 -> "int16";
            case 4 -> "uint32";
            case 5 -> "int32";
            case 6 -> "float32";
            case 7 -> "bool";
            case 8 -> "string";
            case 9 -> "array";
            case 10 -> "uint64";
            case 11 -> "int64";
            case 12 -> "float64";
            default -> "unknown";
        };
    }

    static String fileTypeName(int fileType) {
        return switch (fileType) {
            case 0 -> "ALL_F32";
            case 1 -> "MOSTLY_F16";
            case 2 -> "MOSTLY_Q4_0";
            case 3 -> "MOSTLY_Q4_1";
            case 7 -> "MOSTLY_Q8_0";
            case 8 -> "MOSTLY_Q5_0";
            case 9 -> "MOSTLY_Q5_1";
            case 10 -> "MOSTLY_Q2_K";
            case 15 -> "MOSTLY_Q4_K_M";
            case 17 -> "MOSTLY_Q5_K_M";
            case 18 -> "MOSTLY_Q6_K";
            default -> "UNKNOWN_" + fileType;
        };
    }
}
