package com.libragraph.chunkstore.core.status;

import com.libragraph.chunkstore.core.cluster.NodeService;
import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.coordination.CollectorLock;
import com.libragraph.chunkstore.core.dao.ChunkDao;
import com.libragraph.chunkstore.core.dao.GcRunDao;
import com.libragraph.chunkstore.core.dao.GcRunRecord;
import com.libragraph.chunkstore.core.dao.OrphanStats;
import com.libragraph.chunkstore.core.dao.PendingDeletionDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@ApplicationScoped
public class GcStatusService {

    static final int MAX_HISTORY = 1000;

    private final Jdbi jdbi;
    private final Clock clock;
    private final GcSettings settings;
    private final CollectorLock lock;
    private final NodeService nodeService;

    @Inject
    public GcStatusService(Jdbi jdbi, Clock clock, GcSettings settings, CollectorLock lock,
                           NodeService nodeService) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.settings = settings;
        this.lock = lock;
        this.nodeService = nodeService;
    }

    public GcStatus status() {
        ScheduleStateRecord state = jdbi.withExtension(ScheduleStateDao.class, ScheduleStateDao::get);
        OrphanStats orphans = jdbi.withExtension(ChunkDao.class, ChunkDao::orphanStats);
        long pending = jdbi.withExtension(PendingDeletionDao.class, PendingDeletionDao::count);
        return new GcStatus(
                state.lastRunAt(),
                state.lastSuccessAt(),
                state.nextScheduledAt(),
                orphans.count(),
                orphans.bytes(),
                pending,
                lock.currentHolder().orElse(null),
                state.halted(),
                state.haltedReason(),
                alerts(state, orphans));
    }

    /**
     * Runs, newest first. {@code limit} is clamped to {@code [1, 1000]}.
     */
    public List<GcRunRecord> history(int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_HISTORY));
        return jdbi.withExtension(GcRunDao.class, dao -> dao.recent(bounded));
    }

    public List<GcAlert> alerts() {
        ScheduleStateRecord state = jdbi.withExtension(ScheduleStateDao.class, ScheduleStateDao::get);
        OrphanStats orphans = jdbi.withExtension(ChunkDao.class, ChunkDao::orphanStats);
        return alerts(state, orphans);
    }

    private List<GcAlert> alerts(ScheduleStateRecord state, OrphanStats orphans) {
        List<GcAlert> alerts = new ArrayList<>();
        Instant now = clock.instant();

        // A freshly started node gets one full window before it is considered stale
        Instant since = state.lastSuccessAt() == null || state.lastSuccessAt().isBefore(nodeService.startedAt())
                ? nodeService.startedAt()
                : state.lastSuccessAt();
        if (Duration.between(since, now).compareTo(settings.staleAlertAfter()) > 0) {
            alerts.add(new GcAlert(AlertKind.STALE_COLLECTION, state.lastSuccessAt() == null
                    ? "No successful collection since node start at " + nodeService.startedAt()
                    : "Last successful collection at " + state.lastSuccessAt()));
        }

        long liveBytes = jdbi.withExtension(ChunkDao.class, ChunkDao::liveBytes);
        if (liveBytes > 0) {
            double fraction = (double) orphans.bytes() / liveBytes;
            if (fraction > settings.reclaimableAlertFraction()) {
                alerts.add(new GcAlert(AlertKind.RECLAIMABLE_FRACTION, String.format(
                        "%d of %d bytes (%.1f%%) are unreferenced", orphans.bytes(), liveBytes, fraction * 100)));
            }
        }
        return alerts;
    }
}
