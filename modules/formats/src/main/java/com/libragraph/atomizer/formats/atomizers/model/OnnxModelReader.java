package com.libragraph.atomizer.formats.atomizers.model;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import com.libragraph.atomizer.formats.api.StructuralParseException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the parts of an ONNX {@code ModelProto} the atomizer needs straight off the protobuf wire
 * format. Initializer {@code raw_data} is not copied; its absolute offset in the file is recorded
 * instead.
 */
final class OnnxModelReader {

    // ModelProto
    private static final int MODEL_IR_VERSION = 1;
    private static final int MODEL_PRODUCER_NAME = 2;
    private static final int MODEL_PRODUCER_VERSION = 3;
    private static final int MODEL_DOMAIN = 4;
    private static final int MODEL_VERSION = 5;
    private static final int MODEL_DOC_STRING = 6;
    private static final int MODEL_GRAPH = 7;
    private static final int MODEL_OPSET_IMPORT = 8;
    private static final int MODEL_METADATA_PROPS = 14;

    // GraphProto
    private static final int GRAPH_NODE = 1;
    private static final int GRAPH_NAME = 2;
    private static final int GRAPH_INITIALIZER = 5;

    // NodeProto
    private static final int NODE_INPUT = 1;
    private static final int NODE_OUTPUT = 2;
    private static final int NODE_NAME = 3;
    private static final int NODE_OP_TYPE = 4;
    private static final int NODE_DOMAIN = 7;

    // TensorProto
    private static final int TENSOR_DIMS = 1;
    private static final int TENSOR_DATA_TYPE = 2;
    private static final int TENSOR_FLOAT_DATA = 4;
    private static final int TENSOR_NAME = 8;
    private static final int TENSOR_RAW_DATA = 9;
    private static final int TENSOR_DATA_LOCATION = 14;

    record Node(String name, String opType, String domain, List<String> inputs, List<String> outputs) {
    }

    /**
     * @param rawOffset absolute offset of {@code raw_data}, or -1
     * @param floatData little-endian bytes of {@code float_data}, or null
     */
    record Initializer(String name, int dataType, List<Long> dims, long rawOffset, long rawLength,
                       byte[] floatData, boolean external) {
    }

    static final class Model {
        long irVersion;
        long modelVersion;
        String producerName;
        String producerVersion;
        String domain;
        String docString;
        String graphName;
        final Map<String, Long> opsets = new LinkedHashMap<>();
        final Map<String, String> metadataProps = new LinkedHashMap<>();
        final List<Node> nodes = new ArrayList<>();
        final List<Initializer> initializers = new ArrayList<>();
        boolean sawGraph;
    }

    private OnnxModelReader() {
    }

    static Model read(InputStream in) throws IOException {
        CodedInputStream input = CodedInputStream.newInstance(in);
        input.setSizeLimit(Integer.MAX_VALUE);
        Model model = new Model();
        try {
            int tag;
            while ((tag = input.readTag()) != 0) {
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case MODEL_IR_VERSION -> model.irVersion = input.readInt64();
                    case MODEL_PRODUCER_NAME -> model.producerName = input.readString();
                    case MODEL_PRODUCER_VERSION -> model.producerVersion = input.readString();
                    case MODEL_DOMAIN -> model.domain = input.readString();
                    case MODEL_VERSION -> model.modelVersion = input.readInt64();
                    case MODEL_DOC_STRING -> model.docString = input.readString();
                    case MODEL_GRAPH -> {
                        model.sawGraph = true;
                        int limit = input.pushLimit(input.readRawVarint32());
                        readGraph(input, model);
                        input.popLimit(limit);
                    }
                    case MODEL_OPSET_IMPORT -> readOpset(input, model);
                    case MODEL_METADATA_PROPS -> readProperty(input, model);
                    default -> input.skipField(tag);
                }
            }
        } catch (InvalidProtocolBufferException e) {
            throw new StructuralParseException("Invalid ONNX protobuf: " + e.getMessage(), e);
        }
        if (model.irVersion <= 0 && !model.sawGraph) {
            throw new StructuralParseException("Not an ONNX model: no ir_version or graph");
        }
        return model;
    }

    private static void readGraph(CodedInputStream input, Model model) throws IOException {
        int tag;
        while ((tag = input.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case GRAPH_NODE -> {
                    int limit = input.pushLimit(input.readRawVarint32());
                    model.nodes.add(readNode(input));
                    input.popLimit(limit);
                }
                case GRAPH_NAME -> model.graphName = input.readString();
                case GRAPH_INITIALIZER -> {
                    int limit = input.pushLimit(input.readRawVarint32());
                    model.initializers.add(readTensor(input));
                    input.popLimit(limit);
                }
                default -> input.skipField(tag);
            }
        }
    }

    private static Node readNode(CodedInputStream input) throws IOException {
        String name = "";
        String opType = "";
        String domain = "";
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        int tag;
        while ((tag = input.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case NODE_INPUT -> inputs.add(input.readString());
                case NODE_OUTPUT -> outputs.add(input.readString());
                case NODE_NAME -> name = input.readString();
                case NODE_OP_TYPE -> opType = input.readString();
                case NODE_DOMAIN -> domain = input.readString();
                default -> input.skipField(tag);
            }
        }
        return new Node(name, opType, domain, inputs, outputs);
    }

    private static Initializer readTensor(CodedInputStream input) throws IOException {
        String name = "";
        int dataType = 0;
        List<Long> dims = new ArrayList<>();
        long rawOffset = -1;
        long rawLength = 0;
        List<Float> floats = new ArrayList<>();
        boolean external = false;
        int tag;
        while ((tag = input.readTag()) != 0) {
            int wireType = WireFormat.getTagWireType(tag);
            switch (WireFormat.getTagFieldNumber(tag)) {
                case TENSOR_DIMS -> {
                    if (wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                        int limit = input.pushLimit(input.readRawVarint32());
                        while (input.getBytesUntilLimit() > 0) {
                            dims.add(input.readInt64());
                        }
                        input.popLimit(limit);
                    } else {
                        dims.add(input.readInt64());
                    }
                }
                case TENSOR_DATA_TYPE -> dataType = input.readInt32();
                case TENSOR_FLOAT_DATA -> {
                    if (wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                        int limit = input.pushLimit(input.readRawVarint32());
                        while (input.getBytesUntilLimit() > 0) {
                            floats.add(input.readFloat());
                        }
                        input.popLimit(limit);
                    } else {
                        floats.add(input.readFloat());
                    }
                }
                case TENSOR_NAME -> name = input.readString();
                case TENSOR_RAW_DATA -> {
                    rawLength = input.readRawVarint32();
                    rawOffset = input.getTotalBytesRead();
                    input.skipRawBytes((int) rawLength);
                }
                case TENSOR_DATA_LOCATION -> external = input.readEnum() == 1;
                default -> input.skipField(tag);
            }
        }
        byte[] floatData = null;
        if (!floats.isEmpty()) {
            ByteBuffer buffer = ByteBuffer.allocate(floats.size() * 4).order(ByteOrder.LITTLE_ENDIAN);
            floats.forEach(buffer::putFloat);
            floatData = buffer.array();
        }
        return new Initializer(name, dataType, dims, rawOffset, rawLength, floatData, external);
    }

    private static void readOpset(CodedInputStream input, Model model) throws IOException {
        int limit = input.pushLimit(input.readRawVarint32());
        String domain = "";
        long version = 0;
        int tag;
        while ((tag = input.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> domain = input.readString();
                case 2 -> version = input.readInt64();
                default -> input.skipField(tag);
            }
        }
        input.popLimit(limit);
        model.opsets.put(domain.isEmpty() ? "ai.onnx" : domain, version);
    }

    private static void readProperty(CodedInputStream input, Model model) throws IOException {
        int limit = input.pushLimit(input.readRawVarint32());
        String key = "";
        String value = "";
        int tag;
        while ((tag = input.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> key = input.readString();
                case 2 -> value = input.readString();
                default -> input.skipField(tag);
            }
        }
        input.popLimit(limit);
        model.metadataProps.put(key, value);
    }

    /**
     * Element size in bytes of an ONNX {@code TensorProto.DataType}, or 0 when variable or unknown.
     */
    static int elementSize(int dataType) {
        return switch (dataType) {
            case 1, 6, 12 -> 4;
            case 2, 3, 9 -> 1;
            case 4, 5, 10, 16 -> 2;
            case 7, 11, 13 -> 8;
            default -> 0;
        };
    }

    static String dataTypeName(int dataType) {
        return switch (dataType) {
            case 1 -> "FLOAT";
            case 2 -> "UINT8";
            case 3 -> "INT8";
            case 4 -> "UINT16";
            case 5 -> "INT16";
            case 6 -> "INT32";
            case 7 -> "INT64";
            case 8 -> "STRING";
            case 9 -> "BOOL";
            case 10 -> "FLOAT16";
            case 11 -> "DOUBLE";
            case 12 -> "UINT32";
            case 13 -> "UINT64";
            case 16 -> "BFLOAT16";
            default -> "UNDEFINED_" + dataType;
        };
    }
}
