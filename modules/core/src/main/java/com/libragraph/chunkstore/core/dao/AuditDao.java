package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.audit.AuditAction;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;

/**
 * Insert-only access to the audit trail.
 */
@RegisterConstructorMapper(AuditRecord.class)
public interface AuditDao {

    @SqlUpdate("INSERT INTO gc_audit (recorded_at, gc_run_id, chunk_hash, size_bytes, action, prior_sources, reason, node) " +
            "VALUES (:now, :runId, :hash, :sizeBytes, :action, :priorSources, :reason, :node)")
    void insert(@Bind("now") Instant now,
                @Bind("runId") Long runId,
                @Bind("hash") String hash,
                @Bind("sizeBytes") Long sizeBytes,
                @Bind("action") AuditAction action,
                @Bind("priorSources") String priorSources,
                @Bind("reason") String reason,
                @Bind("node") String node);

    @SqlQuery("SELECT * FROM gc_audit WHERE chunk_hash = :hash ORDER BY id")
    List<AuditRecord> findByChunk(@Bind("hash") String hash);

    @SqlQuery("SELECT * FROM gc_audit WHERE gc_run_id = :runId ORDER BY id")
    List<AuditRecord> findByRun(@Bind("runId") long runId);

    @SqlQuery("SELECT * FROM gc_audit ORDER BY id DESC LIMIT :limit")
    List<AuditRecord> recent(@Bind("limit") int limit);
}
