package com.libragraph.atomizer.formats.pipeline;

import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;

/**
 * Inputs of one format step. {@code rootHash} is the hash of the file-metadata atom the step's
 * top-level atoms compose into.
 */
public record AtomizationContext(
        BinaryData content,
        SourceMetadata source,
        CancellationToken cancellation,
        ContentHash rootHash
) {
    public void checkCancelled() {
        cancellation.throwIfCancellationRequested();
    }
}
