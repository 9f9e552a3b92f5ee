package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import com.libragraph.chunkstore.core.ledger.ReferenceSource;

import java.time.Instant;

/**
 * A reference to add to a chunk. {@code expiresAt} applies to pending uploads only.
 */
public record ReferenceRequest(ReferenceKind kind, String sourceId, String repositoryId, Instant expiresAt) {

    ReferenceSource toSource() {
        return new ReferenceSource(kind, sourceId, repositoryId, expiresAt);
    }
}
