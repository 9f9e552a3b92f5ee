package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.audit.AuditAction;
import com.libragraph.chunkstore.core.audit.AuditEntry;
import com.libragraph.chunkstore.core.audit.AuditLog;
import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.coordination.CoordinationException;
import com.libragraph.chunkstore.core.dao.ChunkDao;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.dao.PendingDeletionDao;
import com.libragraph.chunkstore.core.dao.PendingDeletionRecord;
import com.libragraph.chunkstore.core.event.ChunkDeletedEvent;
import com.libragraph.chunkstore.core.storage.ChunkNotFoundException;
import com.libragraph.chunkstore.core.storage.ChunkStore;
import com.libragraph.chunkstore.core.storage.ChunkValidationException;
import com.libragraph.chunkstore.core.storage.StorageException;
import com.libragraph.chunkstore.core.storage.StorageTier;
import com.libragraph.chunkstore.util.ContentHash;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * The safety pipeline every strategy's candidates go through.
 *
 * <p>Each candidate is handled in its own transaction holding the chunk's row lock, the
 * same lock reference increments take. Under that lock the candidate is re-validated
 * (no references, mark present, grace elapsed); then the bytes are deleted, the row is
 * soft-deleted and the mark removed before commit. An increment racing with the
 * deletion therefore either lands first and the candidate is skipped, or waits and
 * finds the row soft-deleted. A stray object with no row gets a soft-deleted row before
 * its bytes go, so a writer registering the same hash waits the same way.
 *
 * <p>A failure affects only its own chunk: the transaction rolls back, a FAILED audit
 * entry is written separately and the chunk stays eligible for the next run.
 */
@ApplicationScoped
public class ChunkReclaimer {

    private static final Logger log = Logger.getLogger(ChunkReclaimer.class);

    /** Lock wait timeout, deadlock victim and serialization failure, PostgreSQL and H2. */
    private static final Set<String> LOCK_CONTENTION_STATES = Set.of("40P01", "55P03", "40001", "HYT00");

    private final Jdbi jdbi;
    private final Clock clock;
    private final ChunkStore store;
    private final AuditLog auditLog;
    private final ChunkDeletionNotifier notifier;
    private final int deleteRetries;
    private final Duration retryBackoff;

    @Inject
    public ChunkReclaimer(Jdbi jdbi, Clock clock, ChunkStore store, AuditLog auditLog,
                          ChunkDeletionNotifier notifier, GcSettings settings) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.store = store;
        this.auditLog = auditLog;
        this.notifier = notifier;
        this.deleteRetries = settings.deleteRetries();
        this.retryBackoff = settings.retryBackoff();
    }

    public ReclaimOutcome reclaim(CollectionContext context, OrphanCandidate candidate) {
        String hex = candidate.hash().toHex();
        ReclaimOutcome outcome;
        try {
            outcome = jdbi.inTransaction(handle -> revalidateAndDelete(handle, context, candidate));
        } catch (RuntimeException e) {
            return failed(context, candidate, e);
        }
        if (outcome.status() == ReclaimOutcome.Status.DELETED) {
            notifyDeleted(hex, outcome.bytes(), context.runId());
        }
        return outcome;
    }

    private ReclaimOutcome revalidateAndDelete(Handle handle, CollectionContext context, OrphanCandidate candidate) {
        String hex = candidate.hash().toHex();
        Instant now = clock.instant();
        ChunkDao chunks = handle.attach(ChunkDao.class);
        PendingDeletionDao pending = handle.attach(PendingDeletionDao.class);
        boolean sweeping = context.strategy() == CollectionStrategy.MARK_AND_SWEEP;

        Optional<ChunkRecord> locked = chunks.lock(hex);
        ChunkRecord row = locked.orElse(null);
        boolean stray = row == null || row.isDeleted();
        if (stray && !sweeping) {
            log.debugf("Chunk %s already deleted, skipping", hex);
            return ReclaimOutcome.skipped();
        }

        if (row != null && row.refCount() > 0) {
            if (!context.dryRun()) {
                auditLog.append(handle, AuditEntry.of(AuditAction.SKIPPED, hex).size(row.sizeBytes())
                        .run(context.runId()).reason("resurrected: ref_count " + row.refCount()));
            }
            log.debugf("Chunk %s resurrected (ref_count %d), skipping", hex, row.refCount());
            return ReclaimOutcome.skipped();
        }

        Optional<PendingDeletionRecord> mark = pending.find(hex);
        if (mark.isEmpty()) {
            log.debugf("Chunk %s has no pending-deletion mark, skipping", hex);
            return ReclaimOutcome.skipped();
        }
        if (!context.gracePolicy().elapsed(mark.get().markedAt(), mark.get().deleteAfter(), now)) {
            log.debugf("Chunk %s still in grace until %s, skipping", hex, mark.get().deleteAfter());
            return ReclaimOutcome.skipped();
        }

        long bytes = row != null && row.sizeBytes() > 0 ? row.sizeBytes() : candidate.sizeBytes();
        if (context.dryRun()) {
            return ReclaimOutcome.wouldDelete(bytes);
        }

        if (row == null) {
            // A tombstone row lets a writer registering this hash wait on our lock
            if (chunks.insertIfAbsent(hex, bytes, null, StorageTier.HOT, now) == 0) {
                log.debugf("Chunk %s registered while being swept, skipping", hex);
                return ReclaimOutcome.skipped();
            }
            chunks.lock(hex);
        }
        deleteFromStore(candidate.hash()).await().indefinitely();
        chunks.softDelete(hex, now);
        pending.delete(hex);
        auditLog.append(handle, AuditEntry.of(AuditAction.DELETED, hex)
                .size(bytes)
                .run(context.runId())
                .sources(mark.get().priorSources())
                .reason(stray ? "stray object removed by " + context.strategy() : "collected by " + context.strategy()));
        log.debugf("Chunk %s deleted (%d bytes)", hex, bytes);
        return ReclaimOutcome.deleted(bytes);
    }

    private Uni<Void> deleteFromStore(ContentHash hash) {
        Uni<Void> delete = store.delete(hash);
        if (deleteRetries <= 0) {
            return delete;
        }
        return delete.onFailure(StorageException.class).retry()
                .withBackOff(retryBackoff, retryBackoff.multipliedBy(10))
                .atMost(deleteRetries);
    }

    private ReclaimOutcome failed(CollectionContext context, OrphanCandidate candidate, RuntimeException e) {
        String hex = candidate.hash().toHex();
        ChunkErrorKind kind = classify(e);
        String message = rootMessage(e);
        log.warnf("Run %d failed to reclaim chunk %s (%s): %s", context.runId(), hex, kind, message);
        if (!context.dryRun()) {
            try {
                auditLog.append(AuditEntry.of(AuditAction.FAILED, hex)
                        .size(candidate.sizeBytes()).run(context.runId()).reason(kind + ": " + message));
            } catch (RuntimeException auditFailure) {
                log.errorf(auditFailure, "Could not record FAILED audit entry for chunk %s", hex);
                e.addSuppressed(auditFailure);
            }
        }
        return ReclaimOutcome.failed(new ChunkError(hex, kind, message));
    }

    private void notifyDeleted(String hex, long bytes, long runId) {
        try {
            notifier.chunkDeleted(new ChunkDeletedEvent(hex, bytes, runId));
        } catch (RuntimeException e) {
            log.warnf(e, "Deletion notification for chunk %s failed", hex);
        }
    }

    static ChunkErrorKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getSQLState() != null
                    && LOCK_CONTENTION_STATES.contains(sql.getSQLState())) {
                return ChunkErrorKind.LOCK_CONTENTION;
            }
            if (t instanceof ChunkValidationException) {
                return ChunkErrorKind.VALIDATION;
            }
            if (t instanceof ConsistencyException) {
                return ChunkErrorKind.CONSISTENCY;
            }
            if (t instanceof CoordinationException) {
                return ChunkErrorKind.COORDINATION;
            }
            if (t instanceof StorageException || t instanceof ChunkNotFoundException) {
                return ChunkErrorKind.STORAGE;
            }
        }
        return ChunkErrorKind.STORAGE;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return message.length() > 500 ? message.substring(0, 500) : message;
    }
}
