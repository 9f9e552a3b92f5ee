package com.libragraph.chunkstore.core.status;

public enum AlertKind {
    /** No successful collection within the configured window. */
    STALE_COLLECTION,
    /** Too large a share of stored bytes is unreferenced. */
    RECLAIMABLE_FRACTION
}
