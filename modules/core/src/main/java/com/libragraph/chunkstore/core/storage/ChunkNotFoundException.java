package com.libragraph.chunkstore.core.storage;

import com.libragraph.chunkstore.util.ContentHash;

/**
 * Thrown when a read targets a chunk that does not exist.
 */
public class ChunkNotFoundException extends RuntimeException {

    private final ContentHash hash;

    public ChunkNotFoundException(ContentHash hash) {
        super("Chunk not found: " + hash);
        this.hash = hash;
    }

    public ContentHash hash() {
        return hash;
    }
}
