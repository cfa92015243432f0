package com.libragraph.atomizer.formats.pipeline;

import java.io.IOException;

/**
 * Format-specific core transform run by {@link AtomizerPipeline}.
 */
@FunctionalInterface
public interface FormatStep {

    FormatOutcome apply(AtomizationContext context) throws IOException;
}
