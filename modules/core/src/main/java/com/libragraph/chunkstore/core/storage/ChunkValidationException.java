package com.libragraph.chunkstore.core.storage;

/**
 * Thrown when a request is malformed, most commonly when the bytes offered for a
 * chunk do not hash to the key they are stored under.
 */
public class ChunkValidationException extends RuntimeException {

    public ChunkValidationException(String message) {
        super(message);
    }

    public ChunkValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
