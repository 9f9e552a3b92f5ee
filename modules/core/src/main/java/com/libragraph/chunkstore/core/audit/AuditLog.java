package com.libragraph.chunkstore.core.audit;

import com.libragraph.chunkstore.core.cluster.NodeService;
import com.libragraph.chunkstore.core.dao.AuditDao;
import com.libragraph.chunkstore.core.dao.AuditRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.util.List;

/**
 * Append-only record of every state change the collector and ledger make to a chunk's
 * reclamation status. Entries are written inside the transaction that made the change,
 * so an entry exists if and only if the change committed.
 */
@ApplicationScoped
public class AuditLog {

    private final Jdbi jdbi;
    private final Clock clock;
    private final NodeService nodeService;

    @Inject
    public AuditLog(Jdbi jdbi, Clock clock, NodeService nodeService) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.nodeService = nodeService;
    }

    /**
     * Appends within the caller's transaction.
     */
    public void append(Handle handle, AuditEntry entry) {
        handle.attach(AuditDao.class).insert(
                clock.instant(),
                entry.gcRunId(),
                entry.chunkHash(),
                entry.sizeBytes(),
                entry.action(),
                entry.priorSources(),
                entry.reason(),
                nodeService.hostname());
    }

    /**
     * Appends in its own transaction.
     */
    public void append(AuditEntry entry) {
        jdbi.useHandle(handle -> append(handle, entry));
    }

    public List<AuditRecord> forChunk(String hash) {
        return jdbi.withExtension(AuditDao.class, dao -> dao.findByChunk(hash));
    }

    public List<AuditRecord> forRun(long runId) {
        return jdbi.withExtension(AuditDao.class, dao -> dao.findByRun(runId));
    }

    public List<AuditRecord> recent(int limit) {
        return jdbi.withExtension(AuditDao.class, dao -> dao.recent(limit));
    }
}
