package com.libragraph.atomizer.formats.api;

/**
 * Recursion depth or cumulative decompressed size went past its configured ceiling.
 */
public class ResourceLimitExceededException extends AtomizationException {

    private final String limitName;
    private final long limit;
    private final long observed;

    public ResourceLimitExceededException(String limitName, long limit, long observed) {
        super(limitName + " exceeded: " + observed + " > " + limit);
        this.limitName = limitName;
        this.limit = limit;
        this.observed = observed;
    }

    public String limitName() {
        return limitName;
    }

    public long limit() {
        return limit;
    }

    public long observed() {
        return observed;
    }
}
