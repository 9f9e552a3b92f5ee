package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.event.ChunkDeletedEvent;

/**
 * Receives a notification after each committed chunk deletion.
 */
@FunctionalInterface
public interface ChunkDeletionNotifier {

    void chunkDeleted(ChunkDeletedEvent event);
}
