package com.libragraph.atomizer.core.dispatch;

import com.libragraph.atomizer.formats.api.ResourceLimitExceededException;
import com.libragraph.atomizer.formats.api.StructuralParseException;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Why one node of the recursion tree produced no result.
 */
public record NodeFailure(
        Kind kind,
        String message,
        String exceptionType,
        String stackTrace
) {
    public enum Kind { STRUCTURAL, RESOURCE_LIMIT, UNSUPPORTED, ERROR }

    public static NodeFailure from(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));

        Kind kind;
        if (t instanceof StructuralParseException) {
            kind = Kind.STRUCTURAL;
        } else if (t instanceof ResourceLimitExceededException) {
            kind = Kind.RESOURCE_LIMIT;
        } else {
            kind = Kind.ERROR;
        }
        return new NodeFailure(kind, t.getMessage(), t.getClass().getName(), sw.toString());
    }

    public static NodeFailure unsupported(String message) {
        return new NodeFailure(Kind.UNSUPPORTED, message, null, null);
    }
}
