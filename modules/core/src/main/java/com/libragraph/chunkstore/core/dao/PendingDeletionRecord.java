package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record PendingDeletionRecord(
        @ColumnName("chunk_hash") String chunkHash,
        @ColumnName("marked_at") Instant markedAt,
        @ColumnName("delete_after") Instant deleteAfter,
        @ColumnName("gc_run_id") Long gcRunId,
        @ColumnName("prior_sources") String priorSources
) {}
