package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * A zero-reference chunk joined with its pending-deletion mark.
 */
public record OrphanRecord(
        @ColumnName("hash") String hash,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("marked_at") Instant markedAt,
        @ColumnName("delete_after") Instant deleteAfter
) {}
