package com.libragraph.chunkstore.core.storage;

import com.libragraph.chunkstore.util.ContentHash;

/**
 * One object as reported by a store listing.
 */
public record StoredChunk(ContentHash hash, long sizeBytes, StorageTier tier) {
}
