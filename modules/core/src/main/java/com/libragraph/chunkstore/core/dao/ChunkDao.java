package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.storage.StorageTier;
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
 * Ledger rows, one per chunk hash.
 *
 * <p>Every mutation of {@code ref_count} must run inside a transaction that first
 * took the row lock through {@link #lock(String)}.
 */
@RegisterConstructorMapper(ChunkRecord.class)
@RegisterConstructorMapper(OrphanRecord.class)
@RegisterConstructorMapper(OrphanStats.class)
public interface ChunkDao {

    String COLUMNS = "hash, size_bytes, compressed_size, ref_count, storage_tier, " +
            "created_at, last_accessed_at, deleted_at, gc_protected_until";

    @SqlQuery("SELECT " + COLUMNS + " FROM chunk WHERE hash = :hash")
    Optional<ChunkRecord> find(@Bind("hash") String hash);

    @SqlQuery("SELECT " + COLUMNS + " FROM chunk WHERE hash IN (<hashes>)")
    List<ChunkRecord> findAll(@BindList("hashes") Collection<String> hashes);

    /**
     * Reads the row and holds its lock until the surrounding transaction ends.
     */
    @SqlQuery("SELECT " + COLUMNS + " FROM chunk WHERE hash = :hash FOR UPDATE")
    Optional<ChunkRecord> lock(@Bind("hash") String hash);

    @SqlUpdate("INSERT INTO chunk (hash, size_bytes, compressed_size, ref_count, storage_tier, created_at) " +
            "VALUES (:hash, :sizeBytes, :compressedSize, 0, :tier, :now) ON CONFLICT DO NOTHING")
    int insertIfAbsent(@Bind("hash") String hash,
                       @Bind("sizeBytes") long sizeBytes,
                       @Bind("compressedSize") Long compressedSize,
                       @Bind("tier") StorageTier tier,
                       @Bind("now") Instant now);

    /**
     * Fills in payload metadata for a row created by a reference before the payload was written.
     */
    @SqlUpdate("UPDATE chunk SET size_bytes = :sizeBytes, compressed_size = :compressedSize, " +
            "storage_tier = :tier WHERE hash = :hash AND size_bytes = 0")
    int fillUnknownSize(@Bind("hash") String hash,
                        @Bind("sizeBytes") long sizeBytes,
                        @Bind("compressedSize") Long compressedSize,
                        @Bind("tier") StorageTier tier);

    @SqlUpdate("UPDATE chunk SET deleted_at = NULL WHERE hash = :hash AND deleted_at IS NOT NULL")
    int undelete(@Bind("hash") String hash);

    @SqlUpdate("UPDATE chunk SET ref_count = ref_count + 1, deleted_at = NULL WHERE hash = :hash")
    void increment(@Bind("hash") String hash);

    @SqlUpdate("UPDATE chunk SET ref_count = CASE WHEN ref_count > 0 THEN ref_count - 1 ELSE 0 END " +
            "WHERE hash = :hash")
    void decrement(@Bind("hash") String hash);

    @SqlUpdate("UPDATE chunk SET gc_protected_until = :until WHERE hash = :hash")
    void protectUntil(@Bind("hash") String hash, @Bind("until") Instant until);

    @SqlUpdate("UPDATE chunk SET deleted_at = :now, gc_protected_until = NULL WHERE hash = :hash")
    void softDelete(@Bind("hash") String hash, @Bind("now") Instant now);

    @SqlUpdate("UPDATE chunk SET storage_tier = :tier WHERE hash = :hash AND deleted_at IS NULL")
    int changeTier(@Bind("hash") String hash, @Bind("tier") StorageTier tier);

    @SqlUpdate("UPDATE chunk SET last_accessed_at = :now WHERE hash = :hash")
    int touch(@Bind("hash") String hash, @Bind("now") Instant now);

    /**
     * Live zero-reference chunks with no pending-deletion mark and no active protection.
     */
    @SqlQuery("SELECT c.* FROM chunk c " +
            "LEFT JOIN pending_deletion p ON p.chunk_hash = c.hash " +
            "WHERE c.ref_count = 0 AND c.deleted_at IS NULL AND p.chunk_hash IS NULL " +
            "AND (c.gc_protected_until IS NULL OR c.gc_protected_until <= :now) " +
            "AND c.hash > :after ORDER BY c.hash LIMIT :limit")
    List<ChunkRecord> findUnmarkedOrphans(@Bind("after") String after,
                                          @Bind("now") Instant now,
                                          @Bind("limit") int limit);

    /**
     * Marked zero-reference chunks whose grace period has elapsed, created within
     * {@code [createdFrom, createdTo)}, in hash order after {@code after}. A mark
     * qualifies when {@code delete_after <= deleteAfterCutoff} or
     * {@code marked_at <= markedCutoff}.
     */
    @SqlQuery("SELECT c.hash, c.size_bytes, c.created_at, p.marked_at, p.delete_after " +
            "FROM chunk c JOIN pending_deletion p ON p.chunk_hash = c.hash " +
            "WHERE c.ref_count = 0 AND c.deleted_at IS NULL " +
            "AND (p.delete_after <= :deleteAfterCutoff OR p.marked_at <= :markedCutoff) " +
            "AND c.created_at >= :createdFrom AND c.created_at < :createdTo " +
            "AND c.hash > :after ORDER BY c.hash LIMIT :limit")
    List<OrphanRecord> findEligibleOrphans(@Bind("after") String after,
                                           @Bind("deleteAfterCutoff") Instant deleteAfterCutoff,
                                           @Bind("markedCutoff") Instant markedCutoff,
                                           @Bind("createdFrom") Instant createdFrom,
                                           @Bind("createdTo") Instant createdTo,
                                           @Bind("limit") int limit);

    @SqlQuery("SELECT COUNT(*) AS orphan_count, COALESCE(SUM(size_bytes), 0) AS orphan_bytes " +
            "FROM chunk WHERE ref_count = 0 AND deleted_at IS NULL")
    OrphanStats orphanStats();

    @SqlQuery("SELECT COALESCE(SUM(size_bytes), 0) FROM chunk WHERE deleted_at IS NULL")
    long liveBytes();

    /**
     * Soft-deleted rows past the recovery window that nothing references.
     */
    @SqlQuery("SELECT " + COLUMNS + " FROM chunk WHERE deleted_at IS NOT NULL AND deleted_at <= :cutoff " +
            "AND ref_count = 0 AND NOT EXISTS (SELECT 1 FROM chunk_reference r WHERE r.chunk_hash = chunk.hash) " +
            "AND hash > :after ORDER BY hash LIMIT :limit")
    List<ChunkRecord> findPurgeable(@Bind("cutoff") Instant cutoff,
                                    @Bind("after") String after,
                                    @Bind("limit") int limit);

    @SqlUpdate("DELETE FROM chunk WHERE hash = :hash AND deleted_at IS NOT NULL AND deleted_at <= :cutoff " +
            "AND ref_count = 0 AND NOT EXISTS (SELECT 1 FROM chunk_reference r WHERE r.chunk_hash = chunk.hash)")
    int purge(@Bind("hash") String hash, @Bind("cutoff") Instant cutoff);
}
