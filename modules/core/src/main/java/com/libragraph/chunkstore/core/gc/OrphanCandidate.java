package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.util.ContentHash;

/**
 * A chunk a strategy proposes for deletion. Nothing is decided yet: the reclaimer
 * re-validates every candidate under its row lock.
 *
 * @param ledgerTracked false for store objects that have no live ledger row
 */
public record OrphanCandidate(ContentHash hash, long sizeBytes, boolean ledgerTracked) {
}
