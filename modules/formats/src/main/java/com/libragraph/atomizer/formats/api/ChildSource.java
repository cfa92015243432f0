package com.libragraph.atomizer.formats.api;

import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;

/**
 * Nested raw input found while atomizing a container, queued for recursive atomization.
 *
 * <p>A rejected child was not materialized because the container's expansion budget ran out;
 * its content is empty and the dispatcher reports {@link #rejection()} against it.
 *
 * @param parentAtomHash root atom of the container result; the child's root is composed into it
 * @param entryIndex     sequence index of the child under its parent
 * @param rejection      why the entry was not extracted, or null
 */
public record ChildSource(
        BinaryData content,
        SourceMetadata source,
        ContentHash parentAtomHash,
        int entryIndex,
        Position position,
        ResourceLimitExceededException rejection
) {
    public ChildSource(BinaryData content, SourceMetadata source, ContentHash parentAtomHash,
                       int entryIndex, Position position) {
        this(content, source, parentAtomHash, entryIndex, position, null);
    }

    public static ChildSource rejected(SourceMetadata source, ContentHash parentAtomHash, int entryIndex,
                                       Position position, ResourceLimitExceededException rejection) {
        return new ChildSource(BinaryData.of(new byte[0]), source, parentAtomHash, entryIndex, position, rejection);
    }

    public boolean isRejected() {
        return rejection != null;
    }
}
