package com.libragraph.chunkstore.core.audit;

import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import com.libragraph.chunkstore.core.ledger.ReferenceSource;

/**
 * A reference that used to keep a chunk alive, recorded when the chunk is orphaned
 * so a deletion can be traced back to what released it.
 */
public record PriorSource(ReferenceKind kind, String sourceId, String repositoryId) {

    public static PriorSource of(ReferenceSource source) {
        return new PriorSource(source.kind(), source.sourceId(), source.repositoryId());
    }
}
