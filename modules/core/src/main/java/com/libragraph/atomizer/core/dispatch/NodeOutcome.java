package com.libragraph.atomizer.core.dispatch;

import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.SourceMetadata;

/**
 * Result of one node in the recursion tree. {@code path} joins the file names from the root,
 * e.g. {@code bundle.zip!/docs/readme.md}.
 */
public sealed interface NodeOutcome {

    String path();

    int depth();

    SourceMetadata source();

    record Succeeded(String path, int depth, SourceMetadata source, String atomizer,
                     AtomizationResult result) implements NodeOutcome {}

    record Failed(String path, int depth, SourceMetadata source, NodeFailure failure) implements NodeOutcome {}
}
