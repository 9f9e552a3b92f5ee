package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.dao.ChunkDao;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.dao.OrphanRecord;
import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import com.libragraph.chunkstore.util.ContentHash;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Base for strategies that trust {@code ref_count}.
 *
 * <p>A live scan starts by dropping expired pending-upload references. Then there are
 * two phases. First, zero-reference chunks that somehow lack a
 * pending-deletion mark get one, which starts their grace period (skipped for dry runs).
 * Then marked chunks whose grace has elapsed are paged out by ascending hash,
 * restricted to the creation window the subclass chooses.
 */
public abstract class LedgerCandidateFinder implements CandidateFinder {

    private static final Logger log = Logger.getLogger(LedgerCandidateFinder.class);

    /** Upper bound for "no creation limit"; must stay representable as a SQL timestamp. */
    protected static final Instant FAR_FUTURE = Instant.parse("3000-01-01T00:00:00Z");

    protected final Jdbi jdbi;
    protected final Clock clock;
    protected final ReferenceLedger ledger;

    protected LedgerCandidateFinder(Jdbi jdbi, Clock clock, ReferenceLedger ledger) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.ledger = ledger;
    }

    /**
     * Chunks created in {@code [from, to)} are swept. {@code fullSweep} tells
     * {@link #completed} whether every generation was covered.
     */
    protected record CreationWindow(Instant from, Instant to, boolean fullSweep) {
    }

    protected abstract CreationWindow window(CollectionContext context, Instant now);

    protected void completed(CollectionContext context, CreationWindow window) {
    }

    @Override
    public CandidateCursor open(CollectionContext context) {
        if (!context.dryRun()) {
            ledger.reapExpiredUploads(context.runId());
        }
        CreationWindow window = window(context, clock.instant());
        log.debugf("Run %d (%s) sweeping chunks created in [%s, %s)",
                context.runId(), strategy(), window.from(), window.to());
        return new Cursor(context, window);
    }

    private final class Cursor implements CandidateCursor {

        private final CollectionContext context;
        private final CreationWindow window;
        private boolean marking;
        private String after = "";

        Cursor(CollectionContext context, CreationWindow window) {
            this.context = context;
            this.window = window;
            this.marking = !context.dryRun();
        }

        @Override
        public CandidateBatch next(int limit) {
            Instant now = clock.instant();
            String start = after;
            if (marking) {
                List<ChunkRecord> unmarked = jdbi.withExtension(ChunkDao.class,
                        dao -> dao.findUnmarkedOrphans(start, now, limit));
                int marked = 0;
                for (ChunkRecord row : unmarked) {
                    if (ledger.markOrphan(row.hash(), context.runId(), "unmarked orphan found by " + strategy())) {
                        marked++;
                    }
                }
                if (marked > 0) {
                    log.infof("Run %d marked %d unmarked orphans", context.runId(), marked);
                }
                if (unmarked.size() < limit) {
                    marking = false;
                    after = "";
                } else {
                    after = unmarked.get(unmarked.size() - 1).hash();
                }
                return CandidateBatch.of(List.of(), unmarked.size(), false);
            }

            List<OrphanRecord> eligible = jdbi.withExtension(ChunkDao.class, dao -> dao.findEligibleOrphans(
                    start, context.gracePolicy().deleteAfterCutoff(now), context.gracePolicy().markedCutoff(now), window.from(), window.to(), limit));
            if (!eligible.isEmpty()) {
                after = eligible.get(eligible.size() - 1).hash();
            }
            List<OrphanCandidate> candidates = eligible.stream()
                    .map(o -> new OrphanCandidate(ContentHash.fromHex(o.hash()), o.sizeBytes(), true))
                    .toList();
            return CandidateBatch.of(candidates, eligible.size(), eligible.size() < limit);
        }

        @Override
        public void complete() {
            completed(context, window);
        }
    }
}
