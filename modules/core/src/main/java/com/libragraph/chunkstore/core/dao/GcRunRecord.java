package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.gc.CollectionStrategy;
import com.libragraph.chunkstore.core.gc.CollectionTrigger;
import com.libragraph.chunkstore.core.gc.GcRunStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record GcRunRecord(
        @ColumnName("id") long id,
        @ColumnName("strategy") CollectionStrategy strategy,
        @ColumnName("trigger_kind") CollectionTrigger trigger,
        @ColumnName("node") String node,
        @ColumnName("started_at") Instant startedAt,
        @ColumnName("finished_at") Instant finishedAt,
        @ColumnName("status") GcRunStatus status,
        @ColumnName("dry_run") boolean dryRun,
        @ColumnName("chunks_scanned") long chunksScanned,
        @ColumnName("chunks_deleted") long chunksDeleted,
        @ColumnName("bytes_reclaimed") long bytesReclaimed,
        @ColumnName("error_count") int errorCount,
        @ColumnName("error_summary") String errorSummary
) {}
