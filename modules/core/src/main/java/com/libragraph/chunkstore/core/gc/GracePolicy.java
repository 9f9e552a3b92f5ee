package com.libragraph.chunkstore.core.gc;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether a pending-deletion mark has waited long enough.
 *
 * <p>Without an override a mark is elapsed once its {@code delete_after} has passed.
 * An override replaces the grace period for this run, longer or shorter: the mark is
 * elapsed once it is older than the override, whatever its {@code delete_after}.
 */
public record GracePolicy(Duration gracePeriod, Duration override) {

    public GracePolicy {
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        if (override != null && override.isNegative()) {
            throw new IllegalArgumentException("grace override must not be negative: " + override);
        }
    }

    public static GracePolicy standard(Duration gracePeriod) {
        return new GracePolicy(gracePeriod, null);
    }

    public boolean elapsed(Instant markedAt, Instant deleteAfter, Instant now) {
        if (override == null) {
            return !deleteAfter.isAfter(now);
        }
        return !markedAt.isAfter(now.minus(override));
    }

    /**
     * Latest {@code delete_after} that qualifies. With an override no real mark
     * qualifies through {@code delete_after}.
     */
    public Instant deleteAfterCutoff(Instant now) {
        return override == null ? now : Instant.EPOCH;
    }

    /**
     * Latest {@code marked_at} that qualifies. Without an override no real mark
     * qualifies through {@code marked_at}.
     */
    public Instant markedCutoff(Instant now) {
        return override == null ? Instant.EPOCH : now.minus(override);
    }
}
