package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.event.ChunkDeletedEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

/**
 * Publishes deletions as CDI {@link ChunkDeletedEvent}s.
 */
@ApplicationScoped
public class CdiChunkDeletionNotifier implements ChunkDeletionNotifier {

    private final Event<ChunkDeletedEvent> events;

    @Inject
    public CdiChunkDeletionNotifier(Event<ChunkDeletedEvent> events) {
        this.events = events;
    }

    @Override
    public void chunkDeleted(ChunkDeletedEvent event) {
        events.fire(event);
    }
}
