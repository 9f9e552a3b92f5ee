package com.libragraph.chunkstore.core.config;

import com.libragraph.chunkstore.core.gc.CollectionStrategy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

@ApplicationScoped
public class GcSettingsProducer {

    private static final Logger log = Logger.getLogger(GcSettingsProducer.class);

    @ConfigProperty(name = "chunkstore.gc.grace-period", defaultValue = "P7D")
    Duration gracePeriod;

    @ConfigProperty(name = "chunkstore.gc.run-interval", defaultValue = "PT6H")
    Duration runInterval;

    @ConfigProperty(name = "chunkstore.gc.batch-size", defaultValue = "500")
    int batchSize;

    @ConfigProperty(name = "chunkstore.gc.dry-run", defaultValue = "false")
    boolean dryRun;

    @ConfigProperty(name = "chunkstore.gc.default-strategy", defaultValue = "REFERENCE_COUNT")
    CollectionStrategy defaultStrategy;

    @ConfigProperty(name = "chunkstore.gc.min-free-space-percent", defaultValue = "10")
    double minFreeSpacePercent;

    @ConfigProperty(name = "chunkstore.gc.pressure.batch-multiplier", defaultValue = "4")
    int pressureBatchMultiplier;

    @ConfigProperty(name = "chunkstore.gc.pressure.grace-period")
    Optional<Duration> pressureGracePeriod;

    @ConfigProperty(name = "chunkstore.gc.recovery-window", defaultValue = "P30D")
    Duration recoveryWindow;

    @ConfigProperty(name = "chunkstore.gc.lock-key", defaultValue = "chunk-gc")
    String lockKey;

    @ConfigProperty(name = "chunkstore.gc.lock-ttl", defaultValue = "PT10M")
    Duration lockTtl;

    @ConfigProperty(name = "chunkstore.gc.mark-sweep-interval", defaultValue = "P7D")
    Duration markSweepInterval;

    @ConfigProperty(name = "chunkstore.gc.generational.nursery-age", defaultValue = "P1D")
    Duration nurseryAge;

    @ConfigProperty(name = "chunkstore.gc.generational.young-max-age", defaultValue = "P7D")
    Duration youngMaxAge;

    @ConfigProperty(name = "chunkstore.gc.generational.old-generation-interval", defaultValue = "P7D")
    Duration oldGenerationInterval;

    @ConfigProperty(name = "chunkstore.gc.delete-retries", defaultValue = "3")
    int deleteRetries;

    @ConfigProperty(name = "chunkstore.gc.retry-backoff", defaultValue = "PT0.2S")
    Duration retryBackoff;

    @ConfigProperty(name = "chunkstore.gc.alert.stale-after", defaultValue = "PT24H")
    Duration staleAlertAfter;

    @ConfigProperty(name = "chunkstore.gc.alert.reclaimable-fraction", defaultValue = "0.25")
    double reclaimableAlertFraction;

    @Produces
    @Singleton
    public GcSettings gcSettings() {
        GcSettings settings = GcSettings.builder()
                .gracePeriod(gracePeriod)
                .runInterval(runInterval)
                .batchSize(batchSize)
                .dryRun(dryRun)
                .defaultStrategy(defaultStrategy)
                .minFreeSpacePercent(minFreeSpacePercent)
                .pressureBatchMultiplier(pressureBatchMultiplier)
                .pressureGracePeriod(pressureGracePeriod.orElse(null))
                .recoveryWindow(recoveryWindow)
                .lockKey(lockKey)
                .lockTtl(lockTtl)
                .markSweepInterval(markSweepInterval)
                .nurseryAge(nurseryAge)
                .youngMaxAge(youngMaxAge)
                .oldGenerationInterval(oldGenerationInterval)
                .deleteRetries(deleteRetries)
                .retryBackoff(retryBackoff)
                .staleAlertAfter(staleAlertAfter)
                .reclaimableAlertFraction(reclaimableAlertFraction)
                .build();
        log.infof("Collector settings: grace=%s, interval=%s, batch=%d, strategy=%s, dryRun=%s",
                settings.gracePeriod(), settings.runInterval(), settings.batchSize(),
                settings.defaultStrategy(), settings.dryRun());
        return settings;
    }
}
