package com.libragraph.chunkstore.core.status;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of collection health for operators.
 *
 * @param orphanedCount    live chunks with no references
 * @param reclaimableBytes bytes held by those chunks
 * @param lockHolder       node running a collection right now, or null
 */
public record GcStatus(
        Instant lastRunAt,
        Instant lastSuccessAt,
        Instant nextScheduledAt,
        long orphanedCount,
        long reclaimableBytes,
        long pendingDeletionCount,
        String lockHolder,
        boolean halted,
        String haltedReason,
        List<GcAlert> alerts
) {
}
