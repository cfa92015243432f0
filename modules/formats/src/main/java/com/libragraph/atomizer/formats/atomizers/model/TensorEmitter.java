package com.libragraph.atomizer.formats.atomizers.model;

import com.libragraph.atomizer.formats.api.Atom;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import com.libragraph.atomizer.formats.pipeline.AtomGraph;
import com.libragraph.atomizer.formats.pipeline.AtomizationContext;
import com.libragraph.atomizer.types.Modality;
import com.libragraph.atomizer.types.Subtypes;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits a {@code tensor} atom under the file root and its data as 64-byte {@code weight-chunk}
 * children positioned {@code tensor(name, firstElementIndex)}.
 *
 * <p>The tensor hash covers the descriptor and the chunked bytes, so equal tensors in different
 * files deduplicate while same-named tensors with different weights do not.
 */
final class TensorEmitter {

    private final AtomizationContext ctx;
    private final AtomGraph.Builder graph;
    private final int maxChunksPerTensor;
    private long totalChunks;

    TensorEmitter(AtomizationContext ctx, AtomGraph.Builder graph, int maxChunksPerTensor) {
        this.ctx = ctx;
        this.graph = graph;
        this.maxChunksPerTensor = maxChunksPerTensor;
    }

    long totalChunks() {
        return totalChunks;
    }

    /**
     * @param dataOffset     absolute offset of the tensor data in the content
     * @param byteLength     declared data length
     * @param elementsPerByte elements represented by one byte (1/4 for f32; 32/18 for Q4_0 blocks)
     */
    ContentHash emit(String name, String descriptor, Map<String, Object> metadata,
                     long dataOffset, long byteLength, double elementsPerByte) throws IOException {
        return emit(name, descriptor, metadata, ctx.content(), dataOffset, byteLength, elementsPerByte);
    }

    /**
     * Same as {@link #emit(String, String, Map, long, long, double)} with the data read from
     * {@code data} instead of the atomized content.
     */
    ContentHash emit(String name, String descriptor, Map<String, Object> metadata, BinaryData data,
                     long dataOffset, long byteLength, double elementsPerByte) throws IOException {
        if (dataOffset < 0 || byteLength < 0) {
            throw new StructuralParseException("Tensor " + name + " has invalid data range "
                    + dataOffset + "+" + byteLength);
        }
        // an offset at or past the end leaves nothing available and reads as truncation
        long available = Math.max(0, Math.min(byteLength, data.size() - Math.max(0, dataOffset)));
        if (available < byteLength) {
            graph.warn("Tensor " + name + " data truncated: " + available + " of " + byteLength + " bytes present");
        }
        long chunkCount = (available + Atom.MAX_SIZE - 1) / Atom.MAX_SIZE;
        long readable = available;
        if (chunkCount > maxChunksPerTensor) {
            graph.warn("Tensor " + name + " capped at " + maxChunksPerTensor + " of " + chunkCount + " weight chunks");
            readable = (long) maxChunksPerTensor * Atom.MAX_SIZE;
        }

        MessageDigest digest = DigestUtils.getSha256Digest();
        digest.update((Subtypes.TENSOR + ":" + descriptor + ":").getBytes(StandardCharsets.UTF_8));
        List<ContentHash> chunks = new ArrayList<>();
        List<Position> positions = new ArrayList<>();
        if (readable > 0) {
            byte[] chunk = new byte[Atom.MAX_SIZE];
            try (InputStream in = data.inputStream(dataOffset)) {
                long offset = 0;
                while (offset < readable) {
                    if (chunks.size() % 4096 == 0) {
                        ctx.checkCancelled();
                    }
                    int want = (int) Math.min(Atom.MAX_SIZE, readable - offset);
                    int read = in.readNBytes(chunk, 0, want);
                    if (read <= 0) {
                        break;
                    }
                    byte[] value = Arrays.copyOf(chunk, read);
                    digest.update(value);
                    chunks.add(graph.add(Atom.leaf(value, Modality.MODEL, Subtypes.WEIGHT_CHUNK, null, null)));
                    positions.add(Position.tensor(name, (long) (offset * elementsPerByte)));
                    offset += read;
                }
            }
        }
        totalChunks += chunks.size();

        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("byteLength", byteLength);
        meta.put("chunks", chunks.size());
        if (available < byteLength) meta.put("truncated", true);
        if (readable < available) meta.put("capped", true);

        ContentHash tensorHash = new ContentHash(digest.digest());
        graph.addNode(tensorHash, Modality.MODEL, Subtypes.TENSOR, descriptor.getBytes(StandardCharsets.UTF_8),
                name, meta);
        graph.link(ctx.rootHash(), tensorHash, Position.tensor(name, 0));
        if (graph.markExpanded(tensorHash)) {
            for (int i = 0; i < chunks.size(); i++) {
                graph.link(tensorHash, chunks.get(i), positions.get(i));
            }
        }
        return tensorHash;
    }

    /**
     * Adds a {@code model-metadata} atom {@code key=value} under the file root.
     */
    void metadata(String key, String rendered, Map<String, Object> extra) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("key", key);
        meta.putAll(extra);
        String text = key + "=" + rendered;
        graph.addChild(ctx.rootHash(), Position.path(key), Modality.MODEL, Subtypes.MODEL_METADATA,
                text.getBytes(StandardCharsets.UTF_8), text, meta);
    }
}
