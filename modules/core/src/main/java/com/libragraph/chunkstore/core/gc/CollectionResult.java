package com.libragraph.chunkstore.core.gc;

import java.util.List;

/**
 * Outcome of {@link GarbageCollector#collect}. For a dry run, {@code candidates} and
 * {@code bytesReclaimed} describe what a live run would have deleted and
 * {@code chunksDeleted} is zero.
 *
 * @param runId      the {@code gc_run} row, or null when the lock was not acquired
 * @param candidates hashes deleted, or that would have been deleted
 * @param lockHolder the node holding the lock when it was denied
 */
public record CollectionResult(
        Long runId,
        CollectionStrategy strategy,
        boolean dryRun,
        GcRunStatus status,
        long chunksScanned,
        long chunksDeleted,
        long bytesReclaimed,
        List<ChunkError> errors,
        List<String> candidates,
        boolean lockAcquired,
        String lockHolder
) {

    public CollectionResult {
        errors = List.copyOf(errors);
        candidates = List.copyOf(candidates);
    }

    public static CollectionResult lockDenied(CollectionStrategy strategy, boolean dryRun, String holder) {
        return new CollectionResult(null, strategy, dryRun, null, 0, 0, 0,
                List.of(), List.of(), false, holder);
    }
}
