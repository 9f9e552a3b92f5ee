package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.gc.CollectionRequest;
import com.libragraph.chunkstore.core.gc.CollectionStrategy;
import com.libragraph.chunkstore.core.gc.CollectionTrigger;

import java.time.Duration;

/**
 * Body of {@code POST /api/gc/collect}. Every field is optional; an empty body asks
 * for a live run of the default strategy.
 *
 * @param gracePeriodOverride ISO-8601 duration, e.g. {@code PT1H}
 */
public record CollectRequest(
        Boolean dryRun,
        CollectionStrategy strategy,
        Duration gracePeriodOverride,
        Integer batchSizeOverride
) {

    CollectionRequest toCollectionRequest() {
        return new CollectionRequest(strategy, CollectionTrigger.MANUAL, Boolean.TRUE.equals(dryRun),
                gracePeriodOverride, batchSizeOverride);
    }
}
