package com.libragraph.atomizer.formats.pipeline;

import java.util.Map;

/**
 * What a format step returns: the detected format, the attributes to record on the
 * file-metadata atom, and the atom graph below it.
 */
public record FormatOutcome(String detectedFormat, Map<String, Object> summary, AtomGraph graph) {

    public FormatOutcome {
        summary = summary == null ? Map.of() : summary;
    }

    public static FormatOutcome of(String detectedFormat, AtomGraph graph) {
        return new FormatOutcome(detectedFormat, Map.of(), graph);
    }
}
