package com.libragraph.chunkstore.core.gc;

/**
 * What {@link ChunkReclaimer} did with one candidate.
 *
 * @param error set for FAILED, and for SKIPPED when the skip revealed an inconsistency
 */
public record ReclaimOutcome(Status status, long bytes, ChunkError error) {

    public enum Status {
        DELETED,
        WOULD_DELETE,
        SKIPPED,
        FAILED
    }

    static ReclaimOutcome deleted(long bytes) {
        return new ReclaimOutcome(Status.DELETED, bytes, null);
    }

    static ReclaimOutcome wouldDelete(long bytes) {
        return new ReclaimOutcome(Status.WOULD_DELETE, bytes, null);
    }

    static ReclaimOutcome skipped() {
        return new ReclaimOutcome(Status.SKIPPED, 0, null);
    }

    static ReclaimOutcome skipped(ChunkError error) {
        return new ReclaimOutcome(Status.SKIPPED, 0, error);
    }

    static ReclaimOutcome failed(ChunkError error) {
        return new ReclaimOutcome(Status.FAILED, 0, error);
    }
}
