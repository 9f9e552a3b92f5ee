package com.libragraph.chunkstore.core.gc;

import java.util.List;

/**
 * One page of a strategy's scan.
 *
 * @param scanned   chunks or objects examined to produce this page
 * @param errors    problems found while scanning, such as ledger/root disagreements
 * @param exhausted true when the scan has nothing further
 */
public record CandidateBatch(List<OrphanCandidate> candidates, List<ChunkError> errors,
                             long scanned, boolean exhausted) {

    public CandidateBatch {
        candidates = List.copyOf(candidates);
        errors = List.copyOf(errors);
    }

    public static CandidateBatch of(List<OrphanCandidate> candidates, long scanned, boolean exhausted) {
        return new CandidateBatch(candidates, List.of(), scanned, exhausted);
    }
}
