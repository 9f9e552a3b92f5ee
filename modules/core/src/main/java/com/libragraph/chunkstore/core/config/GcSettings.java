package com.libragraph.chunkstore.core.config;

import com.libragraph.chunkstore.core.gc.CollectionStrategy;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tuning for the ledger, the collector and its scheduler.
 * Built from {@code chunkstore.gc.*} configuration by {@link GcSettingsProducer}.
 *
 * @param gracePeriod           minimum time a chunk stays unreferenced before it may be deleted
 * @param pressureGracePeriod   shortened grace for storage-pressure runs; empty means never shorten
 * @param recoveryWindow        how long soft-deleted ledger rows are kept before purging
 * @param markSweepInterval     how often a scheduled run uses mark-and-sweep instead of the default strategy
 */
public record GcSettings(
        Duration gracePeriod,
        Duration runInterval,
        int batchSize,
        boolean dryRun,
        CollectionStrategy defaultStrategy,
        double minFreeSpacePercent,
        int pressureBatchMultiplier,
        Optional<Duration> pressureGracePeriod,
        Duration recoveryWindow,
        String lockKey,
        Duration lockTtl,
        Duration markSweepInterval,
        Duration nurseryAge,
        Duration youngMaxAge,
        Duration oldGenerationInterval,
        int deleteRetries,
        Duration retryBackoff,
        Duration staleAlertAfter,
        double reclaimableAlertFraction
) {

    public GcSettings {
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        Objects.requireNonNull(defaultStrategy, "defaultStrategy");
        Objects.requireNonNull(pressureGracePeriod, "pressureGracePeriod");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative: " + gracePeriod);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (pressureBatchMultiplier <= 0) {
            throw new IllegalArgumentException("pressureBatchMultiplier must be positive: " + pressureBatchMultiplier);
        }
        if (youngMaxAge.compareTo(nurseryAge) < 0) {
            throw new IllegalArgumentException("youngMaxAge " + youngMaxAge + " is shorter than nurseryAge " + nurseryAge);
        }
    }

    public static GcSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration gracePeriod = Duration.ofDays(7);
        private Duration runInterval = Duration.ofHours(6);
        private int batchSize = 500;
        private boolean dryRun = false;
        private CollectionStrategy defaultStrategy = CollectionStrategy.REFERENCE_COUNT;
        private double minFreeSpacePercent = 10.0;
        private int pressureBatchMultiplier = 4;
        private Duration pressureGracePeriod;
        private Duration recoveryWindow = Duration.ofDays(30);
        private String lockKey = "chunk-gc";
        private Duration lockTtl = Duration.ofMinutes(10);
        private Duration markSweepInterval = Duration.ofDays(7);
        private Duration nurseryAge = Duration.ofDays(1);
        private Duration youngMaxAge = Duration.ofDays(7);
        private Duration oldGenerationInterval = Duration.ofDays(7);
        private int deleteRetries = 3;
        private Duration retryBackoff = Duration.ofMillis(200);
        private Duration staleAlertAfter = Duration.ofHours(24);
        private double reclaimableAlertFraction = 0.25;

        private Builder() {
        }

        public Builder gracePeriod(Duration v) { this.gracePeriod = v; return this; }
        public Builder runInterval(Duration v) { this.runInterval = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder dryRun(boolean v) { this.dryRun = v; return this; }
        public Builder defaultStrategy(CollectionStrategy v) { this.defaultStrategy = v; return this; }
        public Builder minFreeSpacePercent(double v) { this.minFreeSpacePercent = v; return this; }
        public Builder pressureBatchMultiplier(int v) { this.pressureBatchMultiplier = v; return this; }
        public Builder pressureGracePeriod(Duration v) { this.pressureGracePeriod = v; return this; }
        public Builder recoveryWindow(Duration v) { this.recoveryWindow = v; return this; }
        public Builder lockKey(String v) { this.lockKey = v; return this; }
        public Builder lockTtl(Duration v) { this.lockTtl = v; return this; }
        public Builder markSweepInterval(Duration v) { this.markSweepInterval = v; return this; }
        public Builder nurseryAge(Duration v) { this.nurseryAge = v; return this; }
        public Builder youngMaxAge(Duration v) { this.youngMaxAge = v; return this; }
        public Builder oldGenerationInterval(Duration v) { this.oldGenerationInterval = v; return this; }
        public Builder deleteRetries(int v) { this.deleteRetries = v; return this; }
        public Builder retryBackoff(Duration v) { this.retryBackoff = v; return this; }
        public Builder staleAlertAfter(Duration v) { this.staleAlertAfter = v; return this; }
        public Builder reclaimableAlertFraction(double v) { this.reclaimableAlertFraction = v; return this; }

        public GcSettings build() {
            return new GcSettings(gracePeriod, runInterval, batchSize, dryRun, defaultStrategy,
                    minFreeSpacePercent, pressureBatchMultiplier, Optional.ofNullable(pressureGracePeriod),
                    recoveryWindow, lockKey, lockTtl, markSweepInterval, nurseryAge, youngMaxAge,
                    oldGenerationInterval, deleteRetries, retryBackoff, staleAlertAfter,
                    reclaimableAlertFraction);
        }
    }
}
