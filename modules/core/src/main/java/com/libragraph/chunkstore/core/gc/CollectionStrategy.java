package com.libragraph.chunkstore.core.gc;

public enum CollectionStrategy {
    /** Trusts {@code ref_count}; the default incremental path. */
    REFERENCE_COUNT,
    /** Recomputes reachability from roots and streams the whole store. */
    MARK_AND_SWEEP,
    /** Reference counting partitioned by chunk age. */
    GENERATIONAL
}
