package com.libragraph.atomizer.formats.enrich;

import com.libragraph.atomizer.util.buffer.BinaryData;

import java.util.List;

/**
 * Optional video decoding plugin: samples still frames out of a video container.
 */
public interface FrameExtractor {

    /**
     * @param maxFrames upper bound on returned frames
     */
    List<VideoFrame> extractFrames(BinaryData video, String contentType, int maxFrames) throws Exception;

    /**
     * One decoded frame, encoded as a still image (PNG, JPEG, ...).
     */
    record VideoFrame(int index, double timestampSeconds, byte[] image, String contentType) {
    }
}
