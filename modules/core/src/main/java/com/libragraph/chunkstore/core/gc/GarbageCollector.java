package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.cluster.NodeService;
import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.coordination.CollectorLease;
import com.libragraph.chunkstore.core.coordination.CollectorLock;
import com.libragraph.chunkstore.core.coordination.CoordinationException;
import com.libragraph.chunkstore.core.dao.GcRunDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateRecord;
import io.quarkus.arc.All;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs collection passes.
 *
 * <p>A pass holds the cluster-wide collector lease for its whole duration. The chosen
 * strategy pages out candidates; each one goes through {@link ChunkReclaimer}. Between
 * batches the run's counters are persisted, the lease is renewed and cancellation is
 * checked. Losing the lease aborts the run.
 */
@ApplicationScoped
public class GarbageCollector {

    private static final Logger log = Logger.getLogger(GarbageCollector.class);
    private static final int ERROR_SUMMARY_LENGTH = 4000;

    private final Jdbi jdbi;
    private final Clock clock;
    private final GcSettings settings;
    private final CollectorLock lock;
    private final NodeService nodeService;
    private final ChunkReclaimer reclaimer;
    private final Map<CollectionStrategy, CandidateFinder> finders = new EnumMap<>(CollectionStrategy.class);

    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile boolean shuttingDown;

    @Inject
    public GarbageCollector(Jdbi jdbi, Clock clock, GcSettings settings, CollectorLock lock,
                            NodeService nodeService, ChunkReclaimer reclaimer,
                            @All List<CandidateFinder> finders) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.settings = settings;
        this.lock = lock;
        this.nodeService = nodeService;
        this.reclaimer = reclaimer;
        for (CandidateFinder finder : finders) {
            this.finders.put(finder.strategy(), finder);
        }
    }

    /**
     * Acquires the collector lease, runs one pass and releases the lease. When another
     * node holds the lease, returns a result with {@code lockAcquired = false} without
     * scanning anything.
     *
     * @throws CollectionHaltedException for a live run while collection is halted
     * @throws CoordinationException     if the lease was lost mid-run
     * @throws CollectionException       if the run failed as a whole
     */
    public CollectionResult collect(CollectionRequest request) {
        CollectionStrategy strategy = resolveStrategy(request);
        ensureNotHalted(request);
        Optional<CollectorLease> lease = lock.tryAcquire(nodeService.holderId(), settings.lockTtl());
        if (lease.isEmpty()) {
            String holder = lock.currentHolder().orElse(null);
            log.infof("Collection (%s) not started: lock held by %s", strategy, holder);
            return CollectionResult.lockDenied(strategy, request.dryRun(), holder);
        }
        try {
            return collectUnderLease(request, lease.get());
        } finally {
            lock.release(lease.get());
        }
    }

    /**
     * Runs one pass under a lease the caller already holds and will release.
     */
    public CollectionResult collectUnderLease(CollectionRequest request, CollectorLease lease) {
        CollectionStrategy strategy = resolveStrategy(request);
        ensureNotHalted(request);
        CandidateFinder finder = finders.get(strategy);
        if (finder == null) {
            throw new IllegalStateException("No candidate finder for strategy " + strategy);
        }

        Instant startedAt = clock.instant();
        long runId = jdbi.withExtension(GcRunDao.class, dao -> dao.insert(
                strategy, request.trigger(), lease.holder(), startedAt, GcRunStatus.RUNNING, request.dryRun()));
        GracePolicy grace = new GracePolicy(settings.gracePeriod(), request.gracePeriodOverride());
        int batchSize = request.batchSizeOverride() != null ? request.batchSizeOverride() : settings.batchSize();
        CollectionContext context = new CollectionContext(
                runId, strategy, request.trigger(), request.dryRun(), startedAt, grace, batchSize);
        cancelRequested.set(false);

        log.infof("Collection run %d started: strategy=%s, trigger=%s, dryRun=%s, batch=%d, grace=%s%s",
                runId, strategy, request.trigger(), request.dryRun(), batchSize, settings.gracePeriod(),
                grace.override() != null ? " (override " + grace.override() + ")" : "");

        Tally tally = new Tally();
        GcRunStatus status = GcRunStatus.COMPLETED;
        try {
            CandidateCursor cursor = finder.open(context);
            while (true) {
                CandidateBatch batch = cursor.next(batchSize);
                tally.scanned += batch.scanned();
                tally.errors.addAll(batch.errors());
                for (OrphanCandidate candidate : batch.candidates()) {
                    tally.record(candidate, reclaimer.reclaim(context, candidate));
                }
                jdbi.useExtension(GcRunDao.class, dao -> dao.updateProgress(
                        runId, tally.scanned, tally.deleted, tally.bytes, tally.errors.size()));

                if (batch.exhausted()) {
                    cursor.complete();
                    break;
                }
                if (!lock.renew(lease, settings.lockTtl())) {
                    throw new CoordinationException("Collector lease lost during run " + runId);
                }
                if (stopRequested(context)) {
                    status = GcRunStatus.CANCELLED;
                    break;
                }
            }
        } catch (CoordinationException e) {
            finish(context, GcRunStatus.FAILED, tally, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            finish(context, GcRunStatus.FAILED, tally, e.toString());
            throw new CollectionException(runId, "Collection run " + runId + " failed: " + e.getMessage(), e);
        }

        finish(context, status, tally, null);
        return new CollectionResult(runId, strategy, request.dryRun(), status, tally.scanned,
                request.dryRun() ? 0 : tally.deleted, tally.bytes, tally.errors, tally.candidates,
                true, lease.holder());
    }

    /**
     * Asks the running pass to stop after its current batch.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    @PreDestroy
    void shutdown() {
        shuttingDown = true;
    }

    private boolean stopRequested(CollectionContext context) {
        if (cancelRequested.get() || shuttingDown || Thread.currentThread().isInterrupted()) {
            log.infof("Collection run %d cancelled", context.runId());
            return true;
        }
        if (!context.dryRun() && scheduleState().halted()) {
            log.warnf("Collection run %d stopped by emergency halt", context.runId());
            return true;
        }
        return false;
    }

    private void finish(CollectionContext context, GcRunStatus status, Tally tally, String failure) {
        Instant now = clock.instant();
        String summary = errorSummary(tally.errors, failure);
        jdbi.useTransaction(handle -> {
            handle.attach(GcRunDao.class).finish(context.runId(), status, now, tally.scanned,
                    context.dryRun() ? 0 : tally.deleted, tally.bytes, tally.errors.size(), summary);
            // A manual dry run leaves the schedule alone
            if (!context.dryRun() || context.trigger() != CollectionTrigger.MANUAL) {
                ScheduleStateDao schedule = handle.attach(ScheduleStateDao.class);
                schedule.recordRun(now, now.plus(settings.runInterval()));
                if (status == GcRunStatus.COMPLETED && !context.dryRun()) {
                    schedule.recordSuccess(now);
                }
            }
        });
        if (status == GcRunStatus.FAILED) {
            log.errorf("Collection run %d failed after scanning %d: %s", context.runId(), tally.scanned, failure);
        } else {
            log.infof("Collection run %d %s: scanned=%d, %s=%d, bytes=%d, errors=%d",
                    context.runId(), status, tally.scanned,
                    context.dryRun() ? "wouldDelete" : "deleted",
                    context.dryRun() ? tally.candidates.size() : tally.deleted,
                    tally.bytes, tally.errors.size());
        }
    }

    private void ensureNotHalted(CollectionRequest request) {
        if (request.dryRun()) {
            return;
        }
        ScheduleStateRecord state = scheduleState();
        if (state.halted()) {
            throw new CollectionHaltedException(state.haltedReason());
        }
    }

    private ScheduleStateRecord scheduleState() {
        return jdbi.withExtension(ScheduleStateDao.class, ScheduleStateDao::get);
    }

    private CollectionStrategy resolveStrategy(CollectionRequest request) {
        return request.strategy() != null ? request.strategy() : settings.defaultStrategy();
    }

    private static String errorSummary(List<ChunkError> errors, String failure) {
        if (errors.isEmpty() && failure == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (failure != null) {
            parts.add(failure);
        }
        errors.forEach(error -> parts.add(error.toString()));
        String joined = String.join("; ", parts);
        return joined.length() > ERROR_SUMMARY_LENGTH ? joined.substring(0, ERROR_SUMMARY_LENGTH) : joined;
    }

    private static final class Tally {
        long scanned;
        long deleted;
        long bytes;
        final List<ChunkError> errors = new ArrayList<>();
        final List<String> candidates = new ArrayList<>();

        void record(OrphanCandidate candidate, ReclaimOutcome outcome) {
            switch (outcome.status()) {
                case DELETED -> {
                    deleted++;
                    bytes += outcome.bytes();
                    candidates.add(candidate.hash().toHex());
                }
                case WOULD_DELETE -> {
                    bytes += outcome.bytes();
                    candidates.add(candidate.hash().toHex());
                }
                case SKIPPED, FAILED -> {
                    if (outcome.error() != null) {
                        errors.add(outcome.error());
                    }
                }
            }
        }
    }
}
