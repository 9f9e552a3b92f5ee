package com.libragraph.chunkstore.core.gc;

import java.time.Instant;

/**
 * What a strategy and the reclaimer know about the run they serve.
 */
public record CollectionContext(
        long runId,
        CollectionStrategy strategy,
        CollectionTrigger trigger,
        boolean dryRun,
        Instant startedAt,
        GracePolicy gracePolicy,
        int batchSize
) {
}
