package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.gc.CollectionStrategy;
import com.libragraph.chunkstore.core.gc.CollectionTrigger;
import com.libragraph.chunkstore.core.gc.GcRunStatus;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(GcRunRecord.class)
public interface GcRunDao {

    @SqlUpdate("INSERT INTO gc_run (strategy, trigger_kind, node, started_at, status, dry_run) " +
            "VALUES (:strategy, :trigger, :node, :now, :status, :dryRun)")
    @GetGeneratedKeys("id")
    long insert(@Bind("strategy") CollectionStrategy strategy,
                @Bind("trigger") CollectionTrigger trigger,
                @Bind("node") String node,
                @Bind("now") Instant now,
                @Bind("status") GcRunStatus status,
                @Bind("dryRun") boolean dryRun);

    @SqlUpdate("UPDATE gc_run SET chunks_scanned = :scanned, chunks_deleted = :deleted, " +
            "bytes_reclaimed = :bytes, error_count = :errors WHERE id = :id")
    void updateProgress(@Bind("id") long id,
                        @Bind("scanned") long scanned,
                        @Bind("deleted") long deleted,
                        @Bind("bytes") long bytes,
                        @Bind("errors") int errors);

    @SqlUpdate("UPDATE gc_run SET status = :status, finished_at = :now, chunks_scanned = :scanned, " +
            "chunks_deleted = :deleted, bytes_reclaimed = :bytes, error_count = :errors, " +
            "error_summary = :errorSummary WHERE id = :id")
    void finish(@Bind("id") long id,
                @Bind("status") GcRunStatus status,
                @Bind("now") Instant now,
                @Bind("scanned") long scanned,
                @Bind("deleted") long deleted,
                @Bind("bytes") long bytes,
                @Bind("errors") int errors,
                @Bind("errorSummary") String errorSummary);

    @SqlQuery("SELECT * FROM gc_run WHERE id = :id")
    Optional<GcRunRecord> find(@Bind("id") long id);

    @SqlQuery("SELECT * FROM gc_run ORDER BY id DESC LIMIT :limit")
    List<GcRunRecord> recent(@Bind("limit") int limit);
}
