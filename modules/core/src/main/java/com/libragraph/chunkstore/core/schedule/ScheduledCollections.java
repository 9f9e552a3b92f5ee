package com.libragraph.chunkstore.core.schedule;

import com.libragraph.chunkstore.core.audit.RecoveryService;
import com.libragraph.chunkstore.core.cluster.NodeService;
import com.libragraph.chunkstore.core.status.GcAlert;
import com.libragraph.chunkstore.core.status.GcStatusService;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Timer entry points. Each job only delegates; the decisions live in the services.
 */
@ApplicationScoped
public class ScheduledCollections {

    private static final Logger log = Logger.getLogger(ScheduledCollections.class);

    @Inject
    CollectionScheduler scheduler;

    @Inject
    RecoveryService recoveryService;

    @Inject
    GcStatusService statusService;

    @Inject
    NodeService nodeService;

    @Scheduled(every = "${chunkstore.gc.tick-interval:60s}", concurrentExecution = SKIP)
    void collect() {
        scheduler.tick().ifPresent(result -> log.debugf("Scheduled tick ran collection %d", result.runId()));
    }

    @Scheduled(every = "${chunkstore.gc.purge-interval:1h}", concurrentExecution = SKIP)
    void purge() {
        recoveryService.purgeExpired();
    }

    @Scheduled(every = "${chunkstore.gc.alert.check-interval:5m}", concurrentExecution = SKIP)
    void checkAlerts() {
        for (GcAlert alert : statusService.alerts()) {
            log.warnf("Collection alert %s: %s", alert.kind(), alert.message());
        }
    }

    @Scheduled(every = "30s", concurrentExecution = SKIP)
    void heartbeat() {
        nodeService.heartbeat();
    }
}
