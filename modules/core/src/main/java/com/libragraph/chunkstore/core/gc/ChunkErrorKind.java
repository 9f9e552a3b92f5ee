package com.libragraph.chunkstore.core.gc;

public enum ChunkErrorKind {
    /** Object store I/O failed, including after retries. */
    STORAGE,
    /** Ledger and roots (or ledger and store) disagree. */
    CONSISTENCY,
    /** Row lock timed out or the database chose this transaction as a deadlock victim. */
    LOCK_CONTENTION,
    VALIDATION,
    COORDINATION
}
