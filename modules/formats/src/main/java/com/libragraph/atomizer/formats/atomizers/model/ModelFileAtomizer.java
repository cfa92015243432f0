package com.libragraph.atomizer.formats.atomizers.model;

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
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Weight files without a dedicated parser (PyTorch, Keras/HDF5, TFLite, TensorFlow graphs,
 * pickles). The format is sniffed from the header, the first 64 bytes become a
 * {@code model-header} atom and the whole file one {@code tensor} of {@code weight-chunk}s.
 */
@ApplicationScoped
public class ModelFileAtomizer implements Atomizer {

    static final long ENTROPY_SAMPLE_BYTES = 16L * 1024 * 1024;

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(50,
            Set.of("application/x-pytorch", "application/x-hdf5", "application/x-hdf", "application/x-tflite"),
            Set.of("pt", "pth", "ckpt", "bin", "h5", "hdf5", "tflite", "pb", "keras", "pkl"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(ModelFileAtomizer.class.getSimpleName(), Modality.MODEL);
    private final int maxChunksPerTensor;

    @Inject
    public ModelFileAtomizer(@ConfigProperty(name = "atomizer.model.max-chunks-per-tensor", defaultValue = "65536")
                             int maxChunksPerTensor) {
        this.maxChunksPerTensor = maxChunksPerTensor;
    }

    public ModelFileAtomizer() {
        this(65536);
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeWeights);
    }

    private FormatOutcome atomizeWeights(AtomizationContext ctx) throws IOException {
        byte[] header = ctx.content().readHeader(Atom.MAX_SIZE);
        String format = sniff(header, ctx.source().fileExtension());

        AtomGraph.Builder graph = AtomGraph.builder();
        graph.addChild(ctx.rootHash(), Position.offset(0), Modality.MODEL, Subtypes.MODEL_HEADER, header,
                format, Map.of("format", format));

        TensorEmitter emitter = new TensorEmitter(ctx, graph, maxChunksPerTensor);
        long size = ctx.content().size();
        emitter.emit(ctx.source().fileName(), format + ":" + size, Map.of("format", format), 0, size, 1.0);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("format", format);
        summary.put("weightChunks", emitter.totalChunks());
        summary.put("entropy", entropy(ctx.content()));
        return new FormatOutcome(format, summary, graph.build());
    }

    static String sniff(byte[] header, String extension) {
        if (startsWith(header, 0, 'P', 'K', 3, 4)) {
            return "pytorch-zip";
        }
        if (startsWith(header, 0, 0x89, 'H', 'D', 'F', '\r', '\n', 0x1A, '\n')) {
            return "hdf5";
        }
        if (startsWith(header, 4, 'T', 'F', 'L', '3')) {
            return "tflite";
        }
        if (header.length >= 2 && (header[0] & 0xFF) == 0x80 && header[1] >= 2 && header[1] <= 5) {
            return "pickle";
        }
        if ("pb".equals(extension)) {
            return "tensorflow-protobuf";
        }
        return extension == null ? "unknown" : extension;
    }

    /**
     * Shannon entropy in bits per byte over the first {@value #ENTROPY_SAMPLE_BYTES} bytes.
     */
    static double entropy(BinaryData content) throws IOException {
        long[] counts = new long[256];
        long total = 0;
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = content.inputStream(0)) {
            int read;
            while (total < ENTROPY_SAMPLE_BYTES && (read = in.read(buffer)) > 0) {
                for (int i = 0; i < read; i++) {
                    counts[buffer[i] & 0xFF]++;
                }
                total += read;
            }
        }
        if (total == 0) {
            return 0.0;
        }
        double entropy = 0.0;
        for (long count : counts) {
            if (count > 0) {
                double p = count / (double) total;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }

    private static boolean startsWith(byte[] data, int offset, int... prefix) {
        if (data.length < offset + prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((data[offset + i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
