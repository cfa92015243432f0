package com.libragraph.atomizer.formats.atomizers.media;

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
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * PCM audio (WAV, AIFF, AU) split into fixed-duration {@code audio-buffer} carriers whose
 * {@code pcm-chunk} children hold whole sample frames. Buffers are positioned
 * {@code (sampleOffset, channels, 0, seconds)}.
 *
 * <p>Streams the JDK cannot decode (MP3, FLAC, Ogg) are stored as 64-byte {@code encoded-chunk}
 * atoms with a warning.
 */
@ApplicationScoped
public class AudioAtomizer implements Atomizer {

    private static final Logger log = Logger.getLogger(AudioAtomizer.class);

    public static final int DEFAULT_BUFFER_MILLIS = 1000;

    private static final DetectionCriteria CRITERIA = DetectionCriteria.of(25,
            Set.of("audio/*"),
            Set.of("wav", "wave", "aif", "aiff", "aifc", "au", "snd", "mp3", "flac", "ogg", "oga", "m4a"));

    private final AtomizerPipeline pipeline = new AtomizerPipeline(AudioAtomizer.class.getSimpleName(), Modality.AUDIO);
    private final int bufferMillis;

    @Inject
    public AudioAtomizer(@ConfigProperty(name = "atomizer.audio.buffer-millis", defaultValue = "1000") int bufferMillis) {
        if (bufferMillis <= 0) {
            throw new IllegalArgumentException("atomizer.audio.buffer-millis must be positive: " + bufferMillis);
        }
        this.bufferMillis = bufferMillis;
    }

    public AudioAtomizer() {
        this(DEFAULT_BUFFER_MILLIS);
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        return pipeline.run(content, source, cancellation, this::atomizeAudio);
    }

    private FormatOutcome atomizeAudio(AtomizationContext ctx) throws IOException {
        AtomGraph.Builder graph = AtomGraph.builder();
        try (InputStream in = new BufferedInputStream(ctx.content().inputStream(0))) {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(in);
            try (AudioInputStream audio = AudioSystem.getAudioInputStream(in)) {
                return decodePcm(ctx, fileFormat, audio, graph);
            }
        } catch (UnsupportedAudioFileException e) {
            log.debugf("No PCM decoder for %s: %s", ctx.source().fileName(), e.getMessage());
            return encodedChunks(ctx, graph);
        }
    }

    private FormatOutcome decodePcm(AtomizationContext ctx, AudioFileFormat fileFormat,
                                    AudioInputStream audio, AtomGraph.Builder graph) throws IOException {
        AudioFormat format = audio.getFormat();
        int frameSize = format.getFrameSize();
        float frameRate = format.getFrameRate();
        if (frameSize <= 0 || frameRate <= 0) {
            graph.warn("Audio format of " + ctx.source().fileName() + " has no fixed frame size; stored encoded");
            return encodedChunks(ctx, graph);
        }

        int framesPerBuffer = Math.max(1, Math.round(frameRate * bufferMillis / 1000f));
        int chunkBytes = frameSize <= Atom.MAX_SIZE ? (Atom.MAX_SIZE / frameSize) * frameSize : Atom.MAX_SIZE;
        byte[] buffer = new byte[framesPerBuffer * frameSize];

        long sampleOffset = 0;
        int buffers = 0;
        while (true) {
            ctx.checkCancelled();
            int read = audio.readNBytes(buffer, 0, buffer.length);
            if (read <= 0) {
                break;
            }
            int whole = read - read % frameSize;
            if (whole < read) {
                graph.warn("Trailing partial sample frame dropped in " + ctx.source().fileName());
            }
            if (whole == 0) {
                break;
            }
            addBuffer(ctx, graph, Arrays.copyOf(buffer, whole), sampleOffset, format, chunkBytes);
            sampleOffset += whole / frameSize;
            buffers++;
            if (read < buffer.length) {
                break;
            }
        }

        long declaredFrames = audio.getFrameLength();
        if (declaredFrames != AudioSystem.NOT_SPECIFIED && sampleOffset < declaredFrames) {
            graph.warn("Audio data of " + ctx.source().fileName() + " is truncated: "
                    + sampleOffset + " of " + declaredFrames + " frames present");
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("container", fileFormat.getType().toString());
        summary.put("encoding", format.getEncoding().toString());
        summary.put("sampleRate", format.getSampleRate());
        summary.put("channels", format.getChannels());
        summary.put("sampleSizeBits", format.getSampleSizeInBits());
        summary.put("bigEndian", format.isBigEndian());
        summary.put("frames", sampleOffset);
        summary.put("durationSeconds", sampleOffset / (double) frameRate);
        summary.put("bufferMillis", bufferMillis);
        summary.put("buffers", buffers);
        return new FormatOutcome(mimeType(fileFormat.getType()), summary, graph.build());
    }

    private static void addBuffer(AtomizationContext ctx, AtomGraph.Builder graph, byte[] pcm, long sampleOffset,
                                  AudioFormat format, int chunkBytes) {
        ContentHash bufferHash = ContentHash.of(pcm);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("sampleOffset", sampleOffset);
        meta.put("frames", pcm.length / format.getFrameSize());
        graph.addNode(bufferHash, Modality.AUDIO, Subtypes.AUDIO_BUFFER, pcm, null, meta);
        graph.link(ctx.rootHash(), bufferHash,
                new Position(sampleOffset, format.getChannels(), 0, sampleOffset / (double) format.getFrameRate(), null));

        if (pcm.length > Atom.MAX_SIZE && graph.markExpanded(bufferHash)) {
            for (int offset = 0; offset < pcm.length; offset += chunkBytes) {
                byte[] chunk = Arrays.copyOfRange(pcm, offset, Math.min(pcm.length, offset + chunkBytes));
                ContentHash chunkHash = graph.add(Atom.leaf(chunk, Modality.AUDIO, Subtypes.PCM_CHUNK, null, null));
                graph.link(bufferHash, chunkHash,
                        new Position(offset / format.getFrameSize(), format.getChannels(), 0, 0, null));
            }
        }
    }

    private static FormatOutcome encodedChunks(AtomizationContext ctx, AtomGraph.Builder graph) throws IOException {
        graph.warn("No PCM decoder for " + ctx.source().fileName() + "; stored as encoded chunks");
        byte[] chunk = new byte[Atom.MAX_SIZE];
        long offset = 0;
        try (InputStream in = ctx.content().inputStream(0)) {
            int read;
            while ((read = in.readNBytes(chunk, 0, chunk.length)) > 0) {
                if ((offset / Atom.MAX_SIZE) % 4096 == 0) {
                    ctx.checkCancelled();
                }
                graph.addChild(ctx.rootHash(), Position.offset(offset), Modality.AUDIO, Subtypes.ENCODED_CHUNK,
                        Arrays.copyOf(chunk, read), null, null);
                offset += read;
            }
        }
        String declared = ctx.source().contentType();
        return new FormatOutcome(declared, Map.of("decoded", false), graph.build());
    }

    private static String mimeType(AudioFileFormat.Type type) {
        if (AudioFileFormat.Type.WAVE.equals(type)) return "audio/wav";
        if (AudioFileFormat.Type.AIFF.equals(type) || AudioFileFormat.Type.AIFC.equals(type)) return "audio/aiff";
        if (AudioFileFormat.Type.AU.equals(type)) return "audio/basic";
        return "audio/" + type.getExtension();
    }
}
