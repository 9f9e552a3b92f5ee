package com.libragraph.chunkstore.core.ledger;

import com.libragraph.chunkstore.core.audit.AuditAction;
import com.libragraph.chunkstore.core.audit.AuditEntry;
import com.libragraph.chunkstore.core.audit.AuditLog;
import com.libragraph.chunkstore.core.audit.PriorSource;
import com.libragraph.chunkstore.core.audit.PriorSourceCodec;
import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.dao.ChunkDao;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.dao.PendingDeletionDao;
import com.libragraph.chunkstore.core.dao.PendingDeletionRecord;
import com.libragraph.chunkstore.core.dao.ReferenceDao;
import com.libragraph.chunkstore.core.dao.ReferenceRecord;
import com.libragraph.chunkstore.core.storage.StorageTier;
import com.libragraph.chunkstore.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative reference counts for every chunk.
 *
 * <p>Each increment or decrement is one transaction that first takes the chunk's row lock,
 * so operations on the same chunk serialize while different chunks proceed in parallel.
 * Batch operations lock their chunks in ascending hash order. The collector's
 * re-validate-then-delete step takes the same row lock.
 *
 * <p>When a chunk's count drops to zero it gets a pending-deletion mark and
 * {@code gc_protected_until = now + grace}. Any later increment removes the mark, so
 * the presence of a mark proves the chunk has stayed unreferenced since it was set.
 * A chunk explicitly protected beyond {@code now + grace} gets no mark; collection
 * marks it once the protection has passed.
 */
@ApplicationScoped
public class ReferenceLedger {

    private static final Logger log = Logger.getLogger(ReferenceLedger.class);
    private static final int REAP_BATCH = 500;

    private final Jdbi jdbi;
    private final Clock clock;
    private final GcSettings settings;
    private final AuditLog auditLog;
    private final PriorSourceCodec priorSourceCodec;

    @Inject
    public ReferenceLedger(Jdbi jdbi, Clock clock, GcSettings settings,
                           AuditLog auditLog, PriorSourceCodec priorSourceCodec) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.settings = settings;
        this.auditLog = auditLog;
        this.priorSourceCodec = priorSourceCodec;
    }

    /**
     * Records that {@code source} references {@code hash}. A repeated call for the same
     * (hash, kind, source id) is a no-op.
     *
     * @return true if a new reference was recorded
     */
    public boolean incrementReference(ContentHash hash, ReferenceSource source) {
        return incrementReferences(List.of(hash), source) > 0;
    }

    /**
     * Records that {@code source} no longer references {@code hash}. Removing a reference
     * that does not exist is a no-op, so the count never goes below zero.
     *
     * @return true if a reference was removed
     */
    public boolean decrementReference(ContentHash hash, ReferenceSource source) {
        return decrementReferences(List.of(hash), source) > 0;
    }

    /**
     * Adds {@code source} as a reference to every hash, in one transaction.
     *
     * @return number of references actually added
     */
    public int incrementReferences(Collection<ContentHash> hashes, ReferenceSource source) {
        List<String> ordered = lockOrder(hashes);
        if (ordered.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        // Rows must exist before they can be locked
        jdbi.useExtension(ChunkDao.class, dao -> ordered.forEach(
                hex -> dao.insertIfAbsent(hex, 0, null, StorageTier.HOT, now)));
        return jdbi.inTransaction(handle -> {
            int changed = 0;
            for (String hex : ordered) {
                ChunkRecord row = handle.attach(ChunkDao.class).lock(hex)
                        .orElseThrow(() -> new IllegalStateException("Chunk row vanished before lock: " + hex));
                if (addReference(handle, row, source, now)) {
                    changed++;
                }
            }
            return changed;
        });
    }

    /**
     * Removes {@code source}'s reference from every hash, in one transaction.
     *
     * @return number of references actually removed
     */
    public int decrementReferences(Collection<ContentHash> hashes, ReferenceSource source) {
        List<String> ordered = lockOrder(hashes);
        if (ordered.isEmpty()) {
            return 0;
        }
        return jdbi.inTransaction(handle -> {
            Instant now = clock.instant();
            int changed = 0;
            for (String hex : ordered) {
                Optional<ChunkRecord> row = handle.attach(ChunkDao.class).lock(hex);
                if (row.isPresent() && removeReference(handle, row.get(), source, now, "last reference removed")) {
                    changed++;
                }
            }
            return changed;
        });
    }

    /**
     * Removes every reference held by one source, as when a branch is deleted or history
     * is pruned.
     *
     * @return number of references removed
     */
    public int removeSource(ReferenceKind kind, String sourceId) {
        ReferenceSource source = ReferenceSource.of(kind, sourceId);
        List<ContentHash> hashes = jdbi.withExtension(ReferenceDao.class,
                dao -> dao.findChunksBySource(kind, sourceId)).stream()
                .map(ContentHash::fromHex)
                .toList();
        int removed = decrementReferences(hashes, source);
        log.infof("Removed %d references held by %s", removed, source);
        return removed;
    }

    /**
     * Records a written payload. A new or restored chunk that nothing references starts
     * its grace period immediately; pass {@code source} to reference it in the same
     * transaction instead.
     */
    public ChunkRecord registerChunk(ContentHash hash, long sizeBytes, Long compressedSize,
                                     StorageTier tier, ReferenceSource source) {
        return registerChunk(hash, sizeBytes, compressedSize, tier, source, null);
    }

    /**
     * As {@link #registerChunk(ContentHash, long, Long, StorageTier, ReferenceSource)}, for
     * a caller that wrote the payload before this call. If the row turns out soft-deleted,
     * a collector removed the payload after that write, so {@code rewritePayload} runs
     * again while the row lock is held and before the row is restored. A failure there
     * rolls the registration back.
     */
    public ChunkRecord registerChunk(ContentHash hash, long sizeBytes, Long compressedSize,
                                     StorageTier tier, ReferenceSource source, Runnable rewritePayload) {
        String hex = hash.toHex();
        return jdbi.inTransaction(handle -> {
            Instant now = clock.instant();
            ChunkDao chunks = handle.attach(ChunkDao.class);
            boolean created = chunks.insertIfAbsent(hex, sizeBytes, compressedSize, tier, now) > 0;
            ChunkRecord row = chunks.lock(hex)
                    .orElseThrow(() -> new IllegalStateException("Chunk row vanished before lock: " + hex));
            if (row.sizeBytes() == 0 && sizeBytes > 0) {
                chunks.fillUnknownSize(hex, sizeBytes, compressedSize, tier);
            }
            boolean restored = row.isDeleted();
            if (restored) {
                if (rewritePayload != null) {
                    rewritePayload.run();
                }
                chunks.undelete(hex);
                row = chunks.lock(hex).orElseThrow();
                log.infof("Chunk %s re-written after soft delete, ledger row restored", hex);
            }
            if (source != null) {
                addReference(handle, row, source, now);
            } else if (row.refCount() == 0 && (restored || !hasActiveProtection(row, now))) {
                // A mark left from when the object was untracked restarts with the row
                if (restored || created || handle.attach(PendingDeletionDao.class).find(hex).isEmpty()) {
                    startGracePeriod(handle, hex, Math.max(row.sizeBytes(), sizeBytes), now, List.of(), null,
                            "written without references");
                }
            }
            return chunks.find(hex).orElseThrow();
        });
    }

    public ChunkRecord registerChunk(ContentHash hash, long sizeBytes, StorageTier tier) {
        return registerChunk(hash, sizeBytes, null, tier, null);
    }

    /**
     * Removes pending-upload references whose expiry has passed. An upload that never
     * committed stops protecting its chunks here; a chunk left without references is
     * marked and starts its grace period.
     *
     * @return number of references removed
     */
    public int reapExpiredUploads(Long runId) {
        int reaped = 0;
        while (true) {
            Instant now = clock.instant();
            List<ReferenceRecord> expired = jdbi.withExtension(ReferenceDao.class,
                    dao -> dao.findExpiredUploads(now, REAP_BATCH));
            int batchReaped = 0;
            for (ReferenceRecord ref : expired) {
                if (reapUpload(ref, runId)) {
                    batchReaped++;
                }
            }
            reaped += batchReaped;
            if (expired.size() < REAP_BATCH || batchReaped == 0) {
                break;
            }
        }
        if (reaped > 0) {
            log.infof("Removed %d expired pending-upload references", reaped);
        }
        return reaped;
    }

    private boolean reapUpload(ReferenceRecord ref, Long runId) {
        ReferenceSource source = ReferenceSource.pendingUpload(ref.sourceId(), ref.repositoryId(), ref.expiresAt());
        return jdbi.inTransaction(handle -> {
            Optional<ChunkRecord> row = handle.attach(ChunkDao.class).lock(ref.chunkHash());
            if (row.isEmpty()) {
                return false;
            }
            Instant now = clock.instant();
            // Re-read under the lock: the upload may have been committed or renewed meanwhile
            boolean stillExpired = handle.attach(ReferenceDao.class).findByChunk(ref.chunkHash()).stream()
                    .anyMatch(r -> r.sourceKind() == ReferenceKind.PENDING_UPLOAD
                            && r.sourceId().equals(ref.sourceId())
                            && r.expiresAt() != null && !r.expiresAt().isAfter(now));
            if (!stillExpired) {
                return false;
            }
            auditLog.append(handle, AuditEntry.of(AuditAction.EXPIRED, ref.chunkHash())
                    .size(row.get().sizeBytes())
                    .run(runId)
                    .sources(priorSourceCodec.encode(List.of(PriorSource.of(source))))
                    .reason("pending upload expired at " + ref.expiresAt()));
            return removeReference(handle, row.get(), source, now, "pending upload expired");
        });
    }

    /**
     * Starts a grace period for a live zero-reference chunk that has no mark yet.
     * Re-checked under the row lock; returns false if the chunk no longer qualifies.
     */
    public boolean markOrphan(String hex, Long runId, String reason) {
        return jdbi.inTransaction(handle -> {
            Optional<ChunkRecord> row = handle.attach(ChunkDao.class).lock(hex);
            Instant now = clock.instant();
            if (row.isEmpty() || row.get().refCount() > 0 || row.get().isDeleted()
                    || hasActiveProtection(row.get(), now)
                    || handle.attach(PendingDeletionDao.class).find(hex).isPresent()) {
                return false;
            }
            startGracePeriod(handle, hex, row.get().sizeBytes(), now, List.of(), runId, reason);
            return true;
        });
    }

    /**
     * Starts a grace period for a stored object whose ledger row is missing or
     * soft-deleted. Returns false if the ledger tracks it as live.
     */
    public boolean markUntracked(String hex, long sizeBytes, Long runId) {
        return jdbi.inTransaction(handle -> {
            Optional<ChunkRecord> row = handle.attach(ChunkDao.class).lock(hex);
            if (row.isPresent() && !row.get().isDeleted()) {
                return false;
            }
            Instant now = clock.instant();
            int inserted = handle.attach(PendingDeletionDao.class)
                    .insertIfAbsent(hex, now, now.plus(settings.gracePeriod()), runId, "[]");
            if (inserted > 0) {
                String reason = row.isEmpty()
                        ? "object not tracked by ledger"
                        : "object of soft-deleted chunk still stored";
                auditLog.append(handle, AuditEntry.of(AuditAction.MARKED, hex)
                        .size(sizeBytes).run(runId).reason(reason));
            }
            return inserted > 0;
        });
    }

    /**
     * Removes a pending-deletion mark without touching the count, recording why.
     */
    public boolean clearMark(String hex, Long runId, String reason) {
        return jdbi.inTransaction(handle -> {
            handle.attach(ChunkDao.class).lock(hex);
            if (handle.attach(PendingDeletionDao.class).delete(hex) == 0) {
                return false;
            }
            auditLog.append(handle, AuditEntry.of(AuditAction.SKIPPED, hex).run(runId).reason(reason));
            return true;
        });
    }

    public Optional<ChunkRecord> find(ContentHash hash) {
        return jdbi.withExtension(ChunkDao.class, dao -> dao.find(hash.toHex()));
    }

    public List<ReferenceRecord> references(ContentHash hash) {
        return jdbi.withExtension(ReferenceDao.class, dao -> dao.findByChunk(hash.toHex()));
    }

    public Optional<PendingDeletionRecord> pendingDeletion(ContentHash hash) {
        return jdbi.withExtension(PendingDeletionDao.class, dao -> dao.find(hash.toHex()));
    }

    /**
     * Records a storage-class move. Reclamation ignores the tier.
     */
    public boolean changeTier(ContentHash hash, StorageTier tier) {
        return jdbi.withExtension(ChunkDao.class, dao -> dao.changeTier(hash.toHex(), tier)) > 0;
    }

    public void touch(ContentHash hash) {
        jdbi.useExtension(ChunkDao.class, dao -> dao.touch(hash.toHex(), clock.instant()));
    }

    // -- Private helpers; callers hold the chunk's row lock --

    private boolean addReference(Handle handle, ChunkRecord row, ReferenceSource source, Instant now) {
        String hex = row.hash();
        ReferenceDao refs = handle.attach(ReferenceDao.class);
        if (refs.count(hex, source.kind(), source.sourceId()) > 0) {
            return false;
        }
        refs.insert(hex, source.kind(), source.sourceId(), source.repositoryId(), now, source.expiresAt());
        handle.attach(ChunkDao.class).increment(hex);
        if (row.isDeleted()) {
            log.warnf("Chunk %s referenced by %s after soft delete; payload must be re-written", hex, source);
        }
        if (handle.attach(PendingDeletionDao.class).delete(hex) > 0) {
            // The grace period's protection goes with its mark; explicit protection has no mark
            handle.attach(ChunkDao.class).protectUntil(hex, null);
            auditLog.append(handle, AuditEntry.of(AuditAction.RESURRECTED, hex)
                    .size(row.sizeBytes()).reason("referenced by " + source));
            log.debugf("Chunk %s resurrected by %s", hex, source);
        }
        return true;
    }

    private boolean removeReference(Handle handle, ChunkRecord row, ReferenceSource source, Instant now,
                                    String reason) {
        String hex = row.hash();
        if (handle.attach(ReferenceDao.class).delete(hex, source.kind(), source.sourceId()) == 0) {
            return false;
        }
        handle.attach(ChunkDao.class).decrement(hex);
        if (row.refCount() <= 0) {
            log.warnf("Chunk %s had a reference from %s but ref_count %d", hex, source, row.refCount());
        }
        if (row.refCount() > 1 || row.isDeleted()) {
            return true;
        }
        Instant graceEnd = now.plus(settings.gracePeriod());
        if (row.gcProtectedUntil() != null && row.gcProtectedUntil().isAfter(graceEnd)) {
            auditLog.append(handle, AuditEntry.of(AuditAction.SKIPPED, hex)
                    .size(row.sizeBytes())
                    .sources(priorSourceCodec.encode(List.of(PriorSource.of(source))))
                    .reason("last reference removed while protected until " + row.gcProtectedUntil()));
            log.infof("Chunk %s unreferenced but protected until %s; grace starts after that",
                    hex, row.gcProtectedUntil());
            return true;
        }
        startGracePeriod(handle, hex, row.sizeBytes(), now, List.of(PriorSource.of(source)), null, reason);
        return true;
    }

    private void startGracePeriod(Handle handle, String hex, long sizeBytes, Instant now,
                                  List<PriorSource> priorSources, Long runId, String reason) {
        Instant deleteAfter = now.plus(settings.gracePeriod());
        String sourcesJson = priorSourceCodec.encode(priorSources);
        handle.attach(ChunkDao.class).protectUntil(hex, deleteAfter);
        PendingDeletionDao pending = handle.attach(PendingDeletionDao.class);
        pending.delete(hex);
        pending.insertIfAbsent(hex, now, deleteAfter, runId, sourcesJson);
        auditLog.append(handle, AuditEntry.of(AuditAction.MARKED, hex)
                .size(sizeBytes).run(runId).sources(sourcesJson).reason(reason));
        log.debugf("Chunk %s orphaned, eligible for deletion after %s", hex, deleteAfter);
    }

    private static boolean hasActiveProtection(ChunkRecord row, Instant now) {
        return row.gcProtectedUntil() != null && row.gcProtectedUntil().isAfter(now);
    }

    private static List<String> lockOrder(Collection<ContentHash> hashes) {
        return hashes.stream()
                .map(ContentHash::toHex)
                .distinct()
                .sorted()
                .toList();
    }
}
