package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.dao.ChunkDao;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.dao.PendingDeletionDao;
import com.libragraph.chunkstore.core.dao.PendingDeletionRecord;
import com.libragraph.chunkstore.core.dao.ReferenceDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateDao;
import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import com.libragraph.chunkstore.core.storage.ChunkStore;
import com.libragraph.chunkstore.core.storage.ListingPage;
import com.libragraph.chunkstore.core.storage.StoredChunk;
import io.quarkus.arc.All;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recomputes reachability from the roots and walks every object in the store.
 *
 * <p>An unreachable object is marked on first sight and becomes a candidate once its
 * mark has aged past the grace period, so the store is never swept against a stale
 * reachable set. Live runs first drop expired pending-upload references. Disagreements
 * with the ledger are reported, never repaired by deletion:
 * <ul>
 *   <li>unreachable but {@code ref_count > 0}: reported, left alone</li>
 *   <li>reachable but {@code ref_count = 0}: reported, and any pending mark is removed</li>
 * </ul>
 * References added, and marks made, after the roots were read are writes racing the
 * sweep rather than disagreements, and are left to the next run.
 */
@ApplicationScoped
public class MarkAndSweepCandidateFinder implements CandidateFinder {

    private static final Logger log = Logger.getLogger(MarkAndSweepCandidateFinder.class);

    private final Jdbi jdbi;
    private final Clock clock;
    private final ChunkStore store;
    private final ReferenceLedger ledger;
    private final List<RootProvider> rootProviders;

    @Inject
    public MarkAndSweepCandidateFinder(Jdbi jdbi, Clock clock, ChunkStore store, ReferenceLedger ledger,
                                       @All List<RootProvider> rootProviders) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.store = store;
        this.ledger = ledger;
        this.rootProviders = List.copyOf(rootProviders);
    }

    @Override
    public CollectionStrategy strategy() {
        return CollectionStrategy.MARK_AND_SWEEP;
    }

    @Override
    public CandidateCursor open(CollectionContext context) {
        if (!context.dryRun()) {
            ledger.reapExpiredUploads(context.runId());
        }
        Instant snapshotAt = clock.instant();
        Set<String> reachable = new HashSet<>();
        for (RootProvider provider : rootProviders) {
            reachable.addAll(provider.reachableHashes(snapshotAt));
        }
        log.infof("Run %d: %d reachable chunks from %d root providers",
                context.runId(), reachable.size(), rootProviders.size());
        return new Cursor(context, reachable, snapshotAt);
    }

    private final class Cursor implements CandidateCursor {

        private final CollectionContext context;
        private final Set<String> reachable;
        private final Instant snapshotAt;
        private String continuationToken;

        Cursor(CollectionContext context, Set<String> reachable, Instant snapshotAt) {
            this.context = context;
            this.reachable = reachable;
            this.snapshotAt = snapshotAt;
        }

        @Override
        public CandidateBatch next(int limit) {
            ListingPage page = store.list("", continuationToken, limit).await().indefinitely();
            continuationToken = page.continuationToken();
            List<StoredChunk> entries = page.entries();
            if (entries.isEmpty()) {
                return CandidateBatch.of(List.of(), 0, true);
            }

            List<String> hexes = entries.stream().map(e -> e.hash().toHex()).toList();
            Map<String, ChunkRecord> rows = jdbi.withExtension(ChunkDao.class, dao -> dao.findAll(hexes))
                    .stream().collect(Collectors.toMap(ChunkRecord::hash, Function.identity()));
            Map<String, PendingDeletionRecord> marks = jdbi.withExtension(PendingDeletionDao.class,
                            dao -> dao.findAll(hexes))
                    .stream().collect(Collectors.toMap(PendingDeletionRecord::chunkHash, Function.identity()));

            Instant now = clock.instant();
            List<OrphanCandidate> candidates = new ArrayList<>();
            List<ChunkError> errors = new ArrayList<>();
            for (StoredChunk entry : entries) {
                String hex = entry.hash().toHex();
                ChunkRecord row = rows.get(hex);
                PendingDeletionRecord mark = marks.get(hex);
                boolean live = row != null && !row.isDeleted();

                if (reachable.contains(hex)) {
                    if (live && row.refCount() == 0 && mark != null && !mark.markedAt().isBefore(snapshotAt)) {
                        // Last reference removed after the roots were read
                        continue;
                    }
                    if (!live) {
                        errors.add(new ChunkError(hex, ChunkErrorKind.CONSISTENCY,
                                "reachable from roots but not tracked by the ledger"));
                    } else if (row.refCount() == 0) {
                        errors.add(new ChunkError(hex, ChunkErrorKind.CONSISTENCY,
                                "reachable from roots but ledger ref_count is 0"));
                    }
                    if (mark != null && !context.dryRun()) {
                        ledger.clearMark(hex, context.runId(), "reachable from roots");
                    }
                    continue;
                }

                if (live && row.refCount() > 0) {
                    if (referencedSinceSnapshot(hex)) {
                        continue;
                    }
                    errors.add(new ChunkError(hex, ChunkErrorKind.CONSISTENCY,
                            "unreachable from roots but ledger ref_count is " + row.refCount()));
                    continue;
                }

                if (mark != null) {
                    if (context.gracePolicy().elapsed(mark.markedAt(), mark.deleteAfter(), now)) {
                        candidates.add(new OrphanCandidate(entry.hash(), entry.sizeBytes(), live));
                    }
                } else if (!context.dryRun()) {
                    if (live) {
                        ledger.markOrphan(hex, context.runId(), "unreachable from roots");
                    } else {
                        ledger.markUntracked(hex, entry.sizeBytes(), context.runId());
                    }
                }
            }
            if (!errors.isEmpty()) {
                log.warnf("Run %d: %d ledger/root disagreements in page ending %s",
                        context.runId(), errors.size(), hexes.get(hexes.size() - 1));
            }
            return new CandidateBatch(candidates, errors, entries.size(), page.isLast());
        }

        private boolean referencedSinceSnapshot(String hex) {
            return jdbi.withExtension(ReferenceDao.class, dao -> dao.countCreatedSince(hex, snapshotAt)) > 0;
        }

        @Override
        public void complete() {
            if (!context.dryRun()) {
                jdbi.useExtension(ScheduleStateDao.class, dao -> dao.recordMarkSweep(clock.instant()));
            }
        }
    }
}
