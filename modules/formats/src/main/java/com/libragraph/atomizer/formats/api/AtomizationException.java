package com.libragraph.atomizer.formats.api;

public class AtomizationException extends RuntimeException {

    public AtomizationException(String message, Throwable cause) {
        super(message, cause);
    }

    public AtomizationException(String message) {
        super(message);
    }
}
