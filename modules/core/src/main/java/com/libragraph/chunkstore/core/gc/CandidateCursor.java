package com.libragraph.chunkstore.core.gc;

/**
 * Pages through one run's candidates in ascending hash order.
 */
public interface CandidateCursor {

    CandidateBatch next(int limit);

    /**
     * Called once after the final batch when the run was not cancelled.
     */
    default void complete() {
    }
}
