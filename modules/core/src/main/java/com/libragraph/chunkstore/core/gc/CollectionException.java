package com.libragraph.chunkstore.core.gc;

/**
 * A run failed as a whole. The run is recorded FAILED before this is thrown.
 */
public class CollectionException extends RuntimeException {

    private final long runId;

    public CollectionException(long runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public long runId() {
        return runId;
    }
}
