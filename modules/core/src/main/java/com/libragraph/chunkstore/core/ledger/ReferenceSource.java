package com.libragraph.chunkstore.core.ledger;

import com.libragraph.chunkstore.core.storage.ChunkValidationException;

import java.time.Instant;

/**
 * The entity holding a reference: (kind, source id) is unique per chunk, so one
 * source contributes at most one unit to a chunk's {@code ref_count}.
 *
 * @param repositoryId owning repository, informational only
 * @param expiresAt    when a pending upload stops counting as a root; null for other kinds
 */
public record ReferenceSource(ReferenceKind kind, String sourceId, String repositoryId, Instant expiresAt) {

    public ReferenceSource {
        if (kind == null) {
            throw new ChunkValidationException("Reference kind is required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new ChunkValidationException("Reference source id is required");
        }
        if (sourceId.length() > 255) {
            throw new ChunkValidationException("Reference source id longer than 255 characters");
        }
        if (expiresAt != null && kind != ReferenceKind.PENDING_UPLOAD) {
            throw new ChunkValidationException("Only pending uploads expire, got kind " + kind);
        }
    }

    public static ReferenceSource of(ReferenceKind kind, String sourceId) {
        return new ReferenceSource(kind, sourceId, null, null);
    }

    public static ReferenceSource of(ReferenceKind kind, String sourceId, String repositoryId) {
        return new ReferenceSource(kind, sourceId, repositoryId, null);
    }

    public static ReferenceSource pendingUpload(String uploadId, String repositoryId, Instant expiresAt) {
        return new ReferenceSource(ReferenceKind.PENDING_UPLOAD, uploadId, repositoryId, expiresAt);
    }

    @Override
    public String toString() {
        return kind + ":" + sourceId;
    }
}
