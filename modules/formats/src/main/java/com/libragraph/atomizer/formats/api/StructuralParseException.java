package com.libragraph.atomizer.formats.api;

/**
 * A mandatory format invariant is violated: bad magic number, unparsable container header,
 * invalid required syntax. The whole source is treated as failed.
 */
public class StructuralParseException extends AtomizationException {

    public StructuralParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public StructuralParseException(String message) {
        super(message);
    }
}
