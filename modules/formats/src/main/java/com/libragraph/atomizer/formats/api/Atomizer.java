package com.libragraph.atomizer.formats.api;

import com.libragraph.atomizer.util.buffer.BinaryData;

/**
 * Decomposes one content family into atoms and compositions.
 *
 * <p>Implementations should be {@code @ApplicationScoped} CDI beans; the registry
 * discovers them and selects the highest {@link #priority()} among those whose
 * {@link #canHandle} returns true.
 *
 * <p>{@link #atomize} must be a pure function of its inputs: it never mutates the content
 * or the source, and equal content yields equal hashes in the same sequence order.
 */
public interface Atomizer {

    /**
     * Returns the detection criteria for this atomizer.
     */
    DetectionCriteria getDetectionCriteria();

    default int priority() {
        return getDetectionCriteria().priority();
    }

    /**
     * Pure, fast predicate over the declared content type and extension.
     *
     * @param fileExtension extension with or without leading dot, may be null
     */
    default boolean canHandle(String contentType, String fileExtension) {
        return getDetectionCriteria().matches(contentType, fileExtension);
    }

    /**
     * Stable name, reported as {@link ProcessingInfo#atomizerType()}.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Atomizes the content.
     *
     * @throws StructuralParseException when a mandatory format invariant is violated
     * @throws java.util.concurrent.CancellationException when the token is cancelled
     */
    AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation);

    /**
     * Atomizes the content while materializing at most {@code expansionBudget} bytes of child
     * content in total. Containers override this; entries past the budget come back as
     * {@link ChildSource#rejected rejected} children. Atomizers that yield no children ignore it.
     */
    default AtomizationResult atomize(BinaryData content, SourceMetadata source, CancellationToken cancellation,
                                      long expansionBudget) {
        return atomize(content, source, cancellation);
    }

    default AtomizationResult atomize(BinaryData content, SourceMetadata source) {
        return atomize(content, source, CancellationToken.NONE);
    }
}
