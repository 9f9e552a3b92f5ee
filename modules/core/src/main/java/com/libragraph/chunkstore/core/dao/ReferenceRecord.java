package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record ReferenceRecord(
        @ColumnName("chunk_hash") String chunkHash,
        @ColumnName("source_kind") ReferenceKind sourceKind,
        @ColumnName("source_id") String sourceId,
        @ColumnName("repository_id") String repositoryId,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("expires_at") Instant expiresAt
) {}
