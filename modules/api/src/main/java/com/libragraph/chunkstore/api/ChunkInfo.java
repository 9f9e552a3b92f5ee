package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.dao.PendingDeletionRecord;
import com.libragraph.chunkstore.core.dao.ReferenceRecord;

import java.util.List;

/**
 * Ledger view of one chunk: its row, who references it and, if orphaned, its
 * pending-deletion mark.
 */
public record ChunkInfo(ChunkRecord chunk, List<ReferenceRecord> references, PendingDeletionRecord pendingDeletion) {
}
