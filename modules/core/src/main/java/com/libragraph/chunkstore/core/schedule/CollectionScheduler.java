package com.libragraph.chunkstore.core.schedule;

import com.libragraph.chunkstore.core.cluster.NodeService;
import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.coordination.CollectorLease;
import com.libragraph.chunkstore.core.coordination.CollectorLock;
import com.libragraph.chunkstore.core.dao.ScheduleStateDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateRecord;
import com.libragraph.chunkstore.core.event.BulkOperationCompletedEvent;
import com.libragraph.chunkstore.core.gc.CollectionRequest;
import com.libragraph.chunkstore.core.gc.CollectionResult;
import com.libragraph.chunkstore.core.gc.CollectionStrategy;
import com.libragraph.chunkstore.core.gc.CollectionTrigger;
import com.libragraph.chunkstore.core.gc.GarbageCollector;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decides when collection runs.
 *
 * <p>Each tick reads the persisted schedule state and picks at most one run, in this
 * order: nothing while halted; a pressure run when free space is low; a follow-up run
 * once a bulk operation's orphans have aged past the grace period; a scheduled run when
 * the interval has passed. Scheduled runs switch to mark-and-sweep when that is due.
 * The decision is re-made under the collector lease, so two nodes ticking together
 * start at most one run.
 */
@ApplicationScoped
public class CollectionScheduler {

    private static final Logger log = Logger.getLogger(CollectionScheduler.class);

    private final Jdbi jdbi;
    private final Clock clock;
    private final GcSettings settings;
    private final CollectorLock lock;
    private final NodeService nodeService;
    private final GarbageCollector collector;
    private final FreeSpaceProbe freeSpaceProbe;

    @Inject
    public CollectionScheduler(Jdbi jdbi, Clock clock, GcSettings settings, CollectorLock lock,
                               NodeService nodeService, GarbageCollector collector,
                               FreeSpaceProbe freeSpaceProbe) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.settings = settings;
        this.lock = lock;
        this.nodeService = nodeService;
        this.collector = collector;
        this.freeSpaceProbe = freeSpaceProbe;
    }

    /**
     * Runs the collection that is due, if any.
     *
     * @return the run's result, or empty when nothing was due or another node holds the lease
     */
    public Optional<CollectionResult> tick() {
        if (plan(state(), clock.instant()).isEmpty()) {
            return Optional.empty();
        }
        Optional<CollectorLease> lease = lock.tryAcquire(nodeService.holderId(), settings.lockTtl());
        if (lease.isEmpty()) {
            log.debugf("Collection due but lease held by %s", lock.currentHolder().orElse("nobody"));
            return Optional.empty();
        }
        try {
            Optional<CollectionRequest> planned = plan(state(), clock.instant());
            if (planned.isEmpty()) {
                return Optional.empty();
            }
            CollectionRequest request = planned.get();
            if (request.trigger() == CollectionTrigger.BULK_FOLLOWUP) {
                jdbi.useExtension(ScheduleStateDao.class, dao -> dao.setFollowupDue(null));
            }
            return Optional.of(collector.collectUnderLease(request, lease.get()));
        } finally {
            lock.release(lease.get());
        }
    }

    /**
     * Runs a collection now, regardless of the schedule.
     */
    public CollectionResult requestManual(CollectionRequest request) {
        return collector.collect(request);
    }

    /**
     * References released in bulk become collectable one grace period from now; a
     * follow-up run is scheduled for then. The ledger already marked them when their
     * last reference went away.
     */
    public void onBulkOperation(@Observes BulkOperationCompletedEvent event) {
        Instant due = clock.instant().plus(settings.gracePeriod());
        jdbi.useExtension(ScheduleStateDao.class, dao -> dao.setFollowupDue(due));
        log.infof("%s released %d references; follow-up collection due at %s",
                event.description(), event.referencesRemoved(), due);
    }

    /**
     * The run due at {@code now}, or empty.
     */
    Optional<CollectionRequest> plan(ScheduleStateRecord state, Instant now) {
        if (state.halted()) {
            return Optional.empty();
        }

        OptionalDouble free = freeSpaceProbe.freeSpacePercent();
        if (free.isPresent() && free.getAsDouble() < settings.minFreeSpacePercent()) {
            log.debugf("Free space %.1f%% below %.1f%%, pressure collection due",
                    free.getAsDouble(), settings.minFreeSpacePercent());
            return Optional.of(new CollectionRequest(settings.defaultStrategy(), CollectionTrigger.PRESSURE,
                    settings.dryRun(), settings.pressureGracePeriod().orElse(null),
                    settings.batchSize() * settings.pressureBatchMultiplier()));
        }

        if (state.followupDueAt() != null && !state.followupDueAt().isAfter(now)) {
            return Optional.of(new CollectionRequest(settings.defaultStrategy(), CollectionTrigger.BULK_FOLLOWUP,
                    settings.dryRun(), null, null));
        }

        if (state.lastRunAt() == null || !state.lastRunAt().plus(settings.runInterval()).isAfter(now)) {
            boolean sweepDue = state.lastMarkSweepAt() == null
                    || !state.lastMarkSweepAt().plus(settings.markSweepInterval()).isAfter(now);
            CollectionStrategy strategy = sweepDue ? CollectionStrategy.MARK_AND_SWEEP : settings.defaultStrategy();
            return Optional.of(CollectionRequest.scheduled(strategy, settings.dryRun()));
        }
        return Optional.empty();
    }

    private ScheduleStateRecord state() {
        return jdbi.withExtension(ScheduleStateDao.class, ScheduleStateDao::get);
    }
}
