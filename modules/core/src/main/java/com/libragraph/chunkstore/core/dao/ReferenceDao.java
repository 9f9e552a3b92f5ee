package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;

/**
 * Reference rows. Each row backs exactly one unit of its chunk's {@code ref_count};
 * inserts and deletes happen under the chunk's row lock.
 */
@RegisterConstructorMapper(ReferenceRecord.class)
public interface ReferenceDao {

    @SqlQuery("SELECT COUNT(*) FROM chunk_reference " +
            "WHERE chunk_hash = :hash AND source_kind = :kind AND source_id = :sourceId")
    int count(@Bind("hash") String hash,
              @Bind("kind") ReferenceKind kind,
              @Bind("sourceId") String sourceId);

    @SqlUpdate("INSERT INTO chunk_reference (chunk_hash, source_kind, source_id, repository_id, created_at, expires_at) " +
            "VALUES (:hash, :kind, :sourceId, :repositoryId, :now, :expiresAt)")
    void insert(@Bind("hash") String hash,
                @Bind("kind") ReferenceKind kind,
                @Bind("sourceId") String sourceId,
                @Bind("repositoryId") String repositoryId,
                @Bind("now") Instant now,
                @Bind("expiresAt") Instant expiresAt);

    @SqlUpdate("DELETE FROM chunk_reference " +
            "WHERE chunk_hash = :hash AND source_kind = :kind AND source_id = :sourceId")
    int delete(@Bind("hash") String hash,
               @Bind("kind") ReferenceKind kind,
               @Bind("sourceId") String sourceId);

    @SqlQuery("SELECT * FROM chunk_reference WHERE chunk_hash = :hash ORDER BY created_at, source_kind, source_id")
    List<ReferenceRecord> findByChunk(@Bind("hash") String hash);

    @SqlQuery("SELECT chunk_hash FROM chunk_reference " +
            "WHERE source_kind = :kind AND source_id = :sourceId ORDER BY chunk_hash")
    List<String> findChunksBySource(@Bind("kind") ReferenceKind kind, @Bind("sourceId") String sourceId);

    /**
     * Pending-upload references whose expiry has passed, in chunk hash order.
     */
    @SqlQuery("SELECT * FROM chunk_reference WHERE source_kind = 'PENDING_UPLOAD' AND expires_at <= :now " +
            "ORDER BY chunk_hash, source_id LIMIT :limit")
    List<ReferenceRecord> findExpiredUploads(@Bind("now") Instant now, @Bind("limit") int limit);

    /**
     * Number of references to {@code hash} created at or after {@code since}.
     */
    @SqlQuery("SELECT COUNT(*) FROM chunk_reference WHERE chunk_hash = :hash AND created_at >= :since")
    int countCreatedSince(@Bind("hash") String hash, @Bind("since") Instant since);

    /**
     * Hashes named by at least one reference that has not expired.
     */
    @SqlQuery("SELECT DISTINCT chunk_hash FROM chunk_reference WHERE expires_at IS NULL OR expires_at > :now")
    List<String> findLiveChunkHashes(@Bind("now") Instant now);
}
