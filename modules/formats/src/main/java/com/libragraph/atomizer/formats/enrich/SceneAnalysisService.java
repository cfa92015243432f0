package com.libragraph.atomizer.formats.enrich;

import java.util.List;

/**
 * Optional scene description capability. Implementations must be thread-safe.
 */
public interface SceneAnalysisService {

    SceneDescription describe(byte[] image, String contentType) throws Exception;

    record SceneDescription(String caption, List<String> tags, double confidence) {
        public SceneDescription {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }
}
