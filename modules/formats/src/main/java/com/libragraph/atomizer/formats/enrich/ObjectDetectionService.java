package com.libragraph.atomizer.formats.enrich;

import java.util.List;

/**
 * Optional object detection capability. Implementations must be thread-safe.
 */
public interface ObjectDetectionService {

    List<DetectedObject> detect(byte[] image, String contentType) throws Exception;

    /**
     * Bounding box in pixels, origin top-left.
     */
    record DetectedObject(String label, double confidence, int x, int y, int width, int height) {
    }
}
