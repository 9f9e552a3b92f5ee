package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.audit.AuditAction;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record AuditRecord(
        @ColumnName("id") long id,
        @ColumnName("recorded_at") Instant recordedAt,
        @ColumnName("gc_run_id") Long gcRunId,
        @ColumnName("chunk_hash") String chunkHash,
        @ColumnName("size_bytes") Long sizeBytes,
        @ColumnName("action") AuditAction action,
        @ColumnName("prior_sources") String priorSources,
        @ColumnName("reason") String reason,
        @ColumnName("node") String node
) {}
