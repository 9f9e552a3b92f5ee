package com.libragraph.chunkstore.core.gc;

/**
 * A per-chunk failure recorded in a run's error list. The chunk stays eligible for the
 * next run.
 */
public record ChunkError(String hash, ChunkErrorKind kind, String message) {

    @Override
    public String toString() {
        return kind + " " + hash + ": " + message;
    }
}
