package com.libragraph.chunkstore.core.gc;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class GracePolicyTest {

    private static final Instant MARKED = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant DELETE_AFTER = MARKED.plus(Duration.ofDays(7));

    @Test
    void standardPolicyWaitsForDeleteAfter() {
        GracePolicy policy = GracePolicy.standard(Duration.ofDays(7));

        assertThat(policy.elapsed(MARKED, DELETE_AFTER, DELETE_AFTER.minusMillis(1))).isFalse();
        assertThat(policy.elapsed(MARKED, DELETE_AFTER, DELETE_AFTER)).isTrue();
        assertThat(policy.deleteAfterCutoff(DELETE_AFTER)).isEqualTo(DELETE_AFTER);
        assertThat(policy.markedCutoff(DELETE_AFTER)).isEqualTo(Instant.EPOCH);
    }

    @Test
    void overrideShortensTheWait() {
        GracePolicy policy = new GracePolicy(Duration.ofDays(7), Duration.ofHours(1));
        Instant now = MARKED.plus(Duration.ofHours(1));

        assertThat(policy.elapsed(MARKED, DELETE_AFTER, now.minusSeconds(1))).isFalse();
        assertThat(policy.elapsed(MARKED, DELETE_AFTER, now)).isTrue();
        assertThat(policy.markedCutoff(now)).isEqualTo(MARKED);
        assertThat(policy.deleteAfterCutoff(now)).isEqualTo(Instant.EPOCH);
    }

    @Test
    void longerOverrideLengthensTheWait() {
        GracePolicy policy = new GracePolicy(Duration.ofDays(7), Duration.ofDays(30));

        assertThat(policy.elapsed(MARKED, DELETE_AFTER, DELETE_AFTER)).isFalse();
        assertThat(policy.elapsed(MARKED, DELETE_AFTER, MARKED.plus(Duration.ofDays(29)))).isFalse();
        assertThat(policy.elapsed(MARKED, DELETE_AFTER, MARKED.plus(Duration.ofDays(30)))).isTrue();
    }

    @Test
    void requestRejectsInvalidOverrides() {
        assertThatThrownBy(() -> CollectionRequest.manual(null, false).withGracePeriodOverride(Duration.ofHours(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CollectionRequest.manual(null, false).withBatchSize(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CollectionRequest(null, null, false, null, null))
                .isInstanceOf(NullPointerException.class);
    }
}
