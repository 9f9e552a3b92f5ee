package com.libragraph.chunkstore.core.event;

/**
 * Fired after a chunk's deletion committed, so caches can drop the payload.
 */
public record ChunkDeletedEvent(String hash, long sizeBytes, Long gcRunId) {
}
