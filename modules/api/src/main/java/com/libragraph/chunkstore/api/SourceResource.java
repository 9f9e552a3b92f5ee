package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.event.BulkOperationCompletedEvent;
import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.Map;

/**
 * Operations on the entities that hold references (commits, tags, stashes...).
 */
@Path("/api/sources")
@Produces(MediaType.APPLICATION_JSON)
public class SourceResource {

    @Inject
    ReferenceLedger ledger;

    @Inject
    Event<BulkOperationCompletedEvent> bulkOperations;

    /**
     * Drops every reference a deleted branch, pruned commit or cleared cache held.
     */
    @DELETE
    @Path("/{kind}/{sourceId}")
    public Map<String, Object> remove(@PathParam("kind") ReferenceKind kind,
                                      @PathParam("sourceId") String sourceId) {
        int removed = ledger.removeSource(kind, sourceId);
        if (removed > 0) {
            bulkOperations.fire(new BulkOperationCompletedEvent("removal of " + kind + ":" + sourceId, removed));
        }
        return Map.of("referencesRemoved", removed);
    }
}
