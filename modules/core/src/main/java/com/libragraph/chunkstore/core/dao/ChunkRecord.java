package com.libragraph.chunkstore.core.dao;

import com.libragraph.chunkstore.core.storage.StorageTier;
import com.libragraph.chunkstore.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record ChunkRecord(
        @ColumnName("hash") String hash,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("compressed_size") Long compressedSize,
        @ColumnName("ref_count") int refCount,
        @ColumnName("storage_tier") StorageTier storageTier,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("last_accessed_at") Instant lastAccessedAt,
        @ColumnName("deleted_at") Instant deletedAt,
        @ColumnName("gc_protected_until") Instant gcProtectedUntil
) {

    public ContentHash contentHash() {
        return ContentHash.fromHex(hash);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
