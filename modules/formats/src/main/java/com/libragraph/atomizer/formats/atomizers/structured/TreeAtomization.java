package com.libragraph.atomizer.formats.atomizers.structured;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.atomizer.formats.api.AtomizationException;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.formats.pipeline.FormatOutcome;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Walks a Jackson tree into atoms: {@code object} and {@code array} nodes addressed by their
 * compact JSON form, scalar {@code field} leaves holding their JSON literal. Edges carry the
 * child's JSON-pointer path; sequence index is document order among siblings.
 */
final class TreeAtomization {

    private static final ObjectMapper CANONICAL = new ObjectMapper();

    private final ObjectMapper reader;
    private final String format;

    TreeAtomization(ObjectMapper reader, String format) {
        this.reader = reader;
        this.format = format;
    }

    FormatOutcome atomize(AtomizationContext ctx) {
        JsonNode root;
        try {
            root = reader.readTree(ctx.content().inputStream(0));
        } catch (JsonProcessingException e) {
            throw new StructuralParseException("Invalid " + format + " in " + ctx.source().fileName()
                    + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StructuralParseException("Unreadable " + format + " in " + ctx.source().fileName(), e);
        }

        AtomGraph.Builder graph = AtomGraph.builder();
        Walk walk = new Walk(ctx, graph);
        Map<String, Object> summary = new LinkedHashMap<>();
        if (root != null && !root.isMissingNode()) {
            ContentHash top = walk.node(root);
            graph.link(ctx.rootHash(), top, Position.path(""));
            summary.put("rootType", root.getNodeType().name().toLowerCase());
        }
        summary.put("nodes", walk.nodes);
        summary.put("maxDepth", walk.maxDepth);
        return new FormatOutcome(format, summary, graph.build());
    }

    private static final class Walk {
        private final AtomizationContext ctx;
        private final AtomGraph.Builder graph;
        private int nodes;
        private int maxDepth;
        private int depth;

        Walk(AtomizationContext ctx, AtomGraph.Builder graph) {
            this.ctx = ctx;
            this.graph = graph;
        }

        ContentHash node(JsonNode node) {
            return node(node, "");
        }

        private ContentHash node(JsonNode node, String path) {
            if (++nodes % 1024 == 0) {
                ctx.checkCancelled();
            }
            if (!node.isContainerNode()) {
                return scalar(node);
            }

            boolean object = node.isObject();
            String subtype = object ? Subtypes.OBJECT : Subtypes.ARRAY;
            byte[] compact = compact(node);
            ContentHash hash = ContentHash.of(tagged(subtype, compact));
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("path", path);
            meta.put("size", node.size());
            graph.addNode(hash, Modality.STRUCTURED, subtype, compact, path.isEmpty() ? "/" : path, meta);

            if (graph.markExpanded(hash)) {
                depth++;
                maxDepth = Math.max(maxDepth, depth);
                if (object) {
                    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        String childPath = path + "/" + escape(field.getKey());
                        graph.link(hash, node(field.getValue(), childPath), Position.path(childPath));
                    }
                } else {
                    for (int i = 0; i < node.size(); i++) {
                        String childPath = path + "/" + i;
                        graph.link(hash, node(node.get(i), childPath), Position.path(childPath));
                    }
                }
                depth--;
            }
            return hash;
        }

        private ContentHash scalar(JsonNode node) {
            byte[] literal = compact(node);
            String canonical = node.isNull() ? null : node.asText();
            return graph.addPayload(Modality.STRUCTURED, Subtypes.FIELD, literal, canonical,
                    Map.of("type", node.getNodeType().name().toLowerCase()));
        }
    }

    private static byte[] compact(JsonNode node) {
        try {
            return CANONICAL.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new AtomizationException("Failed to serialize tree node", e);
        }
    }

    private static byte[] tagged(String subtype, byte[] compact) {
        byte[] tag = (subtype + ":").getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[tag.length + compact.length];
        System.arraycopy(tag, 0, out, 0, tag.length);
        System.arraycopy(compact, 0, out, tag.length, compact.length);
        return out;
    }

    /**
     * JSON pointer escaping (RFC 6901).
     */
    static String escape(String key) {
        return key.replace("~", "~0").replace("/", "~1");
    }
}
