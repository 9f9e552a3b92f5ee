package com.libragraph.chunkstore.core.gc;

import java.time.Instant;
import java.util.Collection;

/**
 * Contributes reachable chunk hashes to a mark-and-sweep run. Every bean implementing
 * this is consulted; the reachable set is their union.
 */
public interface RootProvider {

    /**
     * Lowercase hex hashes reachable as of {@code now}.
     */
    Collection<String> reachableHashes(Instant now);
}
