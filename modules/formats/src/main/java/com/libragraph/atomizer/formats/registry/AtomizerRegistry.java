package com.libragraph.atomizer.formats.registry;

import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.util.buffer.BinaryData;
import io.quarkus.arc.ClientProxy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Central registry that selects an atomizer per {@code (contentType, extension)}.
 * All {@link Atomizer} beans are discovered via CDI.
 *
 * <p>Selection takes the highest {@link Atomizer#priority()} among matching atomizers;
 * equal priorities are broken by the lexicographically smallest {@link Atomizer#name()},
 * so the outcome never depends on discovery order.
 */
@ApplicationScoped
public class AtomizerRegistry {

    private static final Logger log = Logger.getLogger(AtomizerRegistry.class);

    /** Header size to read for magic detection (covers TAR magic at offset 257). */
    public static final int HEADER_SIZE = 512;

    static final Comparator<Atomizer> PREFERENCE = Comparator
            .comparingInt(Atomizer::priority).reversed()
            .thenComparing(Atomizer::name);

    private final List<Atomizer> atomizers;

    // unwrapped so that name() reports the bean class rather than its client proxy
    @Inject
    public AtomizerRegistry(Instance<Atomizer> atomizers) {
        this(StreamSupport.stream(atomizers.spliterator(), false).map(ClientProxy::unwrap).toList());
    }

    public AtomizerRegistry(List<Atomizer> atomizers) {
        this.atomizers = atomizers.stream().sorted(PREFERENCE).toList();
        log.debugf("Registered atomizers: %s", this.atomizers.stream().map(Atomizer::name).toList());
    }

    /**
     * Atomizers in preference order.
     */
    public List<Atomizer> atomizers() {
        return atomizers;
    }

    /**
     * Highest-priority atomizer whose {@code canHandle} accepts the content type and extension.
     */
    public Optional<Atomizer> find(String contentType, String extension) {
        return atomizers.stream()
                .filter(a -> a.canHandle(contentType, extension))
                .findFirst();
    }

    /**
     * Dispatch selection. The declared content type and extension decide through
     * {@link Atomizer#canHandle}; magic bytes in the header are consulted only when nothing but a
     * catch-all accepts the declaration, e.g. {@code application/octet-stream} with an unknown
     * extension. A text file that happens to start with a magic number stays text.
     */
    public Optional<Atomizer> find(String contentType, String extension, byte[] header) {
        Optional<Atomizer> declared = find(contentType, extension);
        if (declared.isPresent() && !declared.get().getDetectionCriteria().isCatchAll()) {
            return declared;
        }
        Optional<Atomizer> sniffed = atomizers.stream()
                .filter(a -> a.getDetectionCriteria().matchesMagic(header))
                .findFirst();
        if (sniffed.isPresent()) {
            log.debugf("Selected %s by magic bytes for %s", sniffed.get().name(), contentType);
            return sniffed;
        }
        return declared;
    }

    public Optional<Atomizer> find(BinaryData content, String contentType, String extension) {
        return find(contentType, extension, content.readHeader(HEADER_SIZE));
    }
}
