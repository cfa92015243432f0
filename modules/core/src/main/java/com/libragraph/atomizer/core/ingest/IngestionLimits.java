package com.libragraph.atomizer.core.ingest;

/**
 * Ceilings applied to one ingestion's recursion tree.
 *
 * @param maxDepth      deepest child level allowed (the root is depth 0)
 * @param maxTotalBytes cumulative size of every node's content
 */
public record IngestionLimits(int maxDepth, long maxTotalBytes) {

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final long DEFAULT_MAX_TOTAL_BYTES = 1L << 30;

    public IngestionLimits {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }
        if (maxTotalBytes <= 0) {
            throw new IllegalArgumentException("maxTotalBytes must be > 0: " + maxTotalBytes);
        }
    }

    public static IngestionLimits defaults() {
        return new IngestionLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_TOTAL_BYTES);
    }
}
