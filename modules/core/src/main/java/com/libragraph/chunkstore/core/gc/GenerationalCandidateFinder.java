package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.dao.ScheduleStateDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateRecord;
import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;

/**
 * Reference counting partitioned by chunk age.
 *
 * <ul>
 *   <li>nursery, younger than {@code nursery-age}: never swept</li>
 *   <li>young, up to {@code young-max-age}: swept every run</li>
 *   <li>old: swept only once {@code old-generation-interval} has passed since the last
 *       full sweep</li>
 * </ul>
 */
@ApplicationScoped
public class GenerationalCandidateFinder extends LedgerCandidateFinder {

    private static final Logger log = Logger.getLogger(GenerationalCandidateFinder.class);

    private final GcSettings settings;

    @Inject
    public GenerationalCandidateFinder(Jdbi jdbi, Clock clock, ReferenceLedger ledger, GcSettings settings) {
        super(jdbi, clock, ledger);
        this.settings = settings;
    }

    @Override
    public CollectionStrategy strategy() {
        return CollectionStrategy.GENERATIONAL;
    }

    @Override
    protected CreationWindow window(CollectionContext context, Instant now) {
        Instant youngFrom = now.minus(settings.youngMaxAge());
        Instant nurseryFrom = now.minus(settings.nurseryAge());
        ScheduleStateRecord state = jdbi.withExtension(ScheduleStateDao.class, ScheduleStateDao::get);
        Instant lastOld = state.lastOldGenerationAt();
        boolean oldDue = lastOld == null || !lastOld.plus(settings.oldGenerationInterval()).isAfter(now);
        if (oldDue) {
            log.infof("Run %d includes the old generation (last swept %s)", context.runId(), lastOld);
        }
        return new CreationWindow(oldDue ? Instant.EPOCH : youngFrom, nurseryFrom, oldDue);
    }

    @Override
    protected void completed(CollectionContext context, CreationWindow window) {
        if (window.fullSweep() && !context.dryRun()) {
            jdbi.useExtension(ScheduleStateDao.class, dao -> dao.recordOldGeneration(clock.instant()));
        }
    }
}
