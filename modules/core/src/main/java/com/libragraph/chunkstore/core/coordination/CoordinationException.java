package com.libragraph.chunkstore.core.coordination;

/**
 * Thrown when a collection run loses its lease before finishing.
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
