package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Grace-period marks. A row exists only while its chunk has been continuously
 * unreferenced since {@code marked_at}; any increment removes it.
 */
@RegisterConstructorMapper(PendingDeletionRecord.class)
public interface PendingDeletionDao {

    @SqlQuery("SELECT * FROM pending_deletion WHERE chunk_hash = :hash")
    Optional<PendingDeletionRecord> find(@Bind("hash") String hash);

    @SqlQuery("SELECT * FROM pending_deletion WHERE chunk_hash IN (<hashes>)")
    List<PendingDeletionRecord> findAll(@BindList("hashes") Collection<String> hashes);

    @SqlUpdate("INSERT INTO pending_deletion (chunk_hash, marked_at, delete_after, gc_run_id, prior_sources) " +
            "VALUES (:hash, :markedAt, :deleteAfter, :runId, :priorSources) ON CONFLICT DO NOTHING")
    int insertIfAbsent(@Bind("hash") String hash,
                       @Bind("markedAt") Instant markedAt,
                       @Bind("deleteAfter") Instant deleteAfter,
                       @Bind("runId") Long runId,
                       @Bind("priorSources") String priorSources);

    @SqlUpdate("DELETE FROM pending_deletion WHERE chunk_hash = :hash")
    int delete(@Bind("hash") String hash);

    @SqlUpdate("DELETE FROM pending_deletion")
    int deleteAll();

    @SqlQuery("SELECT COUNT(*) FROM pending_deletion")
    long count();

    @SqlQuery("SELECT COUNT(*) FROM pending_deletion WHERE delete_after <= :now")
    long countElapsed(@Bind("now") Instant now);
}
