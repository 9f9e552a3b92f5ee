package com.libragraph.chunkstore.core.gc;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters of one collection run.
 *
 * @param strategy            null selects the configured default
 * @param gracePeriodOverride replaces the grace period for this run, measured from
 *                            each mark's {@code marked_at}; null keeps the marks' own
 *                            {@code delete_after}
 * @param batchSizeOverride   null uses the configured batch size
 */
public record CollectionRequest(
        CollectionStrategy strategy,
        CollectionTrigger trigger,
        boolean dryRun,
        Duration gracePeriodOverride,
        Integer batchSizeOverride
) {

    public CollectionRequest {
        Objects.requireNonNull(trigger, "trigger");
        if (gracePeriodOverride != null && gracePeriodOverride.isNegative()) {
            throw new IllegalArgumentException("gracePeriodOverride must not be negative: " + gracePeriodOverride);
        }
        if (batchSizeOverride != null && batchSizeOverride <= 0) {
            throw new IllegalArgumentException("batchSizeOverride must be positive: " + batchSizeOverride);
        }
    }

    public static CollectionRequest manual(CollectionStrategy strategy, boolean dryRun) {
        return new CollectionRequest(strategy, CollectionTrigger.MANUAL, dryRun, null, null);
    }

    public static CollectionRequest scheduled(CollectionStrategy strategy, boolean dryRun) {
        return new CollectionRequest(strategy, CollectionTrigger.SCHEDULED, dryRun, null, null);
    }

    public CollectionRequest withGracePeriodOverride(Duration override) {
        return new CollectionRequest(strategy, trigger, dryRun, override, batchSizeOverride);
    }

    public CollectionRequest withBatchSize(int batchSize) {
        return new CollectionRequest(strategy, trigger, dryRun, gracePeriodOverride, batchSize);
    }
}
