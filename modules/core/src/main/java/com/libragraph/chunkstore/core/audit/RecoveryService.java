package com.libragraph.chunkstore.core.audit;

import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.dao.ChunkDao;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.dao.PendingDeletionDao;
import com.libragraph.chunkstore.core.dao.ScheduleStateDao;
import com.libragraph.chunkstore.core.gc.ConsistencyException;
import com.libragraph.chunkstore.core.gc.GarbageCollector;
import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import com.libragraph.chunkstore.core.storage.ChunkNotFoundException;
import com.libragraph.chunkstore.core.storage.ChunkStore;
import com.libragraph.chunkstore.core.storage.ChunkValidationException;
import com.libragraph.chunkstore.core.storage.StorageTier;
import com.libragraph.chunkstore.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operator tools for undoing or stopping reclamation: protecting a chunk, restoring a
 * deleted one, purging old soft-deleted rows and the emergency halt.
 */
@ApplicationScoped
public class RecoveryService {

    private static final Logger log = Logger.getLogger(RecoveryService.class);
    private static final int PURGE_BATCH = 500;

    private final Jdbi jdbi;
    private final Clock clock;
    private final GcSettings settings;
    private final ChunkStore store;
    private final ReferenceLedger ledger;
    private final AuditLog auditLog;
    private final GarbageCollector collector;

    @Inject
    public RecoveryService(Jdbi jdbi, Clock clock, GcSettings settings, ChunkStore store,
                           ReferenceLedger ledger, AuditLog auditLog, GarbageCollector collector) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.settings = settings;
        this.store = store;
        this.ledger = ledger;
        this.auditLog = auditLog;
        this.collector = collector;
    }

    /**
     * Keeps a chunk out of collection until {@code until}: removes its pending-deletion
     * mark and extends {@code gc_protected_until}. An existing later protection is kept.
     *
     * @throws ChunkNotFoundException if the ledger has no row for the chunk
     * @throws ConsistencyException   if the chunk is soft-deleted; restore it instead
     */
    public ChunkRecord protect(ContentHash hash, Instant until) {
        String hex = hash.toHex();
        return jdbi.inTransaction(handle -> {
            Instant now = clock.instant();
            if (!until.isAfter(now)) {
                throw new IllegalArgumentException("Protection must end in the future: " + until);
            }
            ChunkDao chunks = handle.attach(ChunkDao.class);
            ChunkRecord row = chunks.lock(hex).orElseThrow(() -> new ChunkNotFoundException(hash));
            if (row.isDeleted()) {
                throw new ConsistencyException("Chunk " + hex + " was deleted at " + row.deletedAt()
                        + "; restore it instead");
            }
            Instant effective = row.gcProtectedUntil() != null && row.gcProtectedUntil().isAfter(until)
                    ? row.gcProtectedUntil()
                    : until;
            chunks.protectUntil(hex, effective);
            boolean unmarked = handle.attach(PendingDeletionDao.class).delete(hex) > 0;
            auditLog.append(handle, AuditEntry.of(AuditAction.PROTECTED, hex)
                    .size(row.sizeBytes())
                    .reason("protected until " + effective + (unmarked ? ", pending deletion cancelled" : "")));
            log.infof("Chunk %s protected until %s", hex, effective);
            return chunks.find(hex).orElseThrow();
        });
    }

    /**
     * Brings a deleted chunk back. If the bytes are no longer in the store, {@code content}
     * must supply them; it is validated against the hash before being stored. A restored
     * chunk that nothing references starts a fresh grace period.
     *
     * @throws ConsistencyException     if the bytes are gone and no content was supplied
     * @throws ChunkValidationException if the supplied content does not match the hash
     */
    public ChunkRecord restore(ContentHash hash, byte[] content) {
        String hex = hash.toHex();
        Optional<ChunkRecord> existing = ledger.find(hash);
        boolean stored = store.exists(hash).await().indefinitely();

        if (existing.isPresent() && !existing.get().isDeleted() && stored) {
            log.debugf("Chunk %s is live, nothing to restore", hex);
            return existing.get();
        }
        if (existing.isEmpty() && content == null) {
            throw new ChunkNotFoundException(hash);
        }
        if (!stored) {
            if (content == null) {
                throw new ConsistencyException("Chunk " + hex + " is no longer in the object store; "
                        + "its content must be supplied to restore it");
            }
            store.put(hash, content).await().indefinitely();
        }

        long size = content != null ? content.length : existing.map(ChunkRecord::sizeBytes).orElse(0L);
        StorageTier tier = existing.map(ChunkRecord::storageTier).orElse(StorageTier.HOT);
        ChunkRecord restored = ledger.registerChunk(hash, size, null, tier, null);
        auditLog.append(AuditEntry.of(AuditAction.RESTORED, hex)
                .size(restored.sizeBytes())
                .reason(stored ? "ledger row restored" : "content re-uploaded"));
        log.infof("Chunk %s restored (%s)", hex, stored ? "bytes were still stored" : "bytes re-uploaded");
        return restored;
    }

    /**
     * Permanently removes ledger rows soft-deleted longer than the recovery window ago.
     *
     * @return number of rows removed
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(settings.recoveryWindow());
        int purged = 0;
        String after = "";
        while (true) {
            String start = after;
            List<ChunkRecord> batch = jdbi.withExtension(ChunkDao.class,
                    dao -> dao.findPurgeable(cutoff, start, PURGE_BATCH));
            for (ChunkRecord row : batch) {
                boolean removed = jdbi.inTransaction(handle -> {
                    handle.attach(ChunkDao.class).lock(row.hash());
                    if (handle.attach(ChunkDao.class).purge(row.hash(), cutoff) == 0) {
                        return false;
                    }
                    auditLog.append(handle, AuditEntry.of(AuditAction.PURGED, row.hash())
                            .size(row.sizeBytes()).reason("deleted at " + row.deletedAt()));
                    return true;
                });
                if (removed) {
                    purged++;
                }
            }
            if (batch.size() < PURGE_BATCH) {
                break;
            }
            after = batch.get(batch.size() - 1).hash();
        }
        if (purged > 0) {
            log.infof("Purged %d ledger rows deleted before %s", purged, cutoff);
        }
        return purged;
    }

    /**
     * Stops all deletion cluster-wide: persists the halt flag and drops every
     * pending-deletion mark, so each orphan needs a full new grace period after
     * {@link #resume()}. A run in progress stops at its next batch.
     *
     * @return number of pending-deletion marks dropped
     */
    public int emergencyHalt(String reason) {
        String why = reason == null || reason.isBlank() ? "unspecified" : reason;
        int cleared = jdbi.inTransaction(handle -> {
            handle.attach(ScheduleStateDao.class).halt(why, clock.instant());
            int dropped = handle.attach(PendingDeletionDao.class).deleteAll();
            auditLog.append(handle, AuditEntry.of(AuditAction.HALTED)
                    .reason(why + " (" + dropped + " pending deletions cancelled)"));
            return dropped;
        });
        collector.cancel();
        log.warnf("Collection halted: %s; %d pending deletions cancelled", why, cleared);
        return cleared;
    }

    public void resume() {
        jdbi.useTransaction(handle -> {
            handle.attach(ScheduleStateDao.class).resume();
            auditLog.append(handle, AuditEntry.of(AuditAction.RESUMED).reason("collection resumed"));
        });
        log.infof("Collection resumed");
    }
}
