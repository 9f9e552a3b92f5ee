package com.libragraph.chunkstore.core.ledger;

/**
 * What kind of entity holds a reference to a chunk.
 */
public enum ReferenceKind {
    COMMIT,
    STAGING_ENTRY,
    STASH,
    TAG,
    /** An upload in flight. Expires so an abandoned upload stops acting as a root. */
    PENDING_UPLOAD,
    CACHE_ENTRY
}
