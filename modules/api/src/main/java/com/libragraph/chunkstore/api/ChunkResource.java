package com.libragraph.chunkstore.api;

import com.libragraph.chunkstore.core.audit.RecoveryService;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import com.libragraph.chunkstore.core.ledger.ReferenceSource;
import com.libragraph.chunkstore.core.storage.ChunkNotFoundException;
import com.libragraph.chunkstore.core.storage.ChunkService;
import com.libragraph.chunkstore.util.ContentHash;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.time.Instant;
import java.util.Map;

@Path("/api/chunks/{hash}")
@Produces(MediaType.APPLICATION_JSON)
public class ChunkResource {

    @Inject
    ChunkService chunkService;

    @Inject
    ReferenceLedger ledger;

    @Inject
    RecoveryService recoveryService;

    /**
     * Stores a chunk. With {@code kind} and {@code sourceId} the reference is recorded in
     * the same transaction, which is how an in-flight upload protects its chunks.
     */
    @PUT
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    public ChunkRecord put(@PathParam("hash") String hash,
                           @QueryParam("kind") ReferenceKind kind,
                           @QueryParam("sourceId") String sourceId,
                           @QueryParam("repositoryId") String repositoryId,
                           @QueryParam("expiresAt") String expiresAt,
                           byte[] content) {
        ReferenceSource source = kind == null && sourceId == null
                ? null
                : new ReferenceSource(kind, sourceId, repositoryId, expiresAt != null ? Instant.parse(expiresAt) : null);
        return chunkService.write(parse(hash), content != null ? content : new byte[0], source)
                .await().indefinitely();
    }

    @GET
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public byte[] get(@PathParam("hash") String hash) {
        return chunkService.read(parse(hash)).await().indefinitely();
    }

    @GET
    @Path("/info")
    public ChunkInfo info(@PathParam("hash") String hash) {
        ContentHash contentHash = parse(hash);
        ChunkRecord row = ledger.find(contentHash).orElseThrow(() -> new ChunkNotFoundException(contentHash));
        return new ChunkInfo(row, ledger.references(contentHash), ledger.pendingDeletion(contentHash).orElse(null));
    }

    @POST
    @Path("/references")
    @Consumes(MediaType.APPLICATION_JSON)
    public Map<String, Object> addReference(@PathParam("hash") String hash, ReferenceRequest body) {
        if (body == null) {
            throw new IllegalArgumentException("Reference body is required");
        }
        boolean added = ledger.incrementReference(parse(hash), body.toSource());
        return Map.of("added", added);
    }

    @DELETE
    @Path("/references/{kind}/{sourceId}")
    public Map<String, Object> removeReference(@PathParam("hash") String hash,
                                               @PathParam("kind") ReferenceKind kind,
                                               @PathParam("sourceId") String sourceId) {
        boolean removed = ledger.decrementReference(parse(hash), ReferenceSource.of(kind, sourceId));
        return Map.of("removed", removed);
    }

    @POST
    @Path("/protect")
    public ChunkRecord protect(@PathParam("hash") String hash, @QueryParam("until") String until) {
        if (until == null) {
            throw new IllegalArgumentException("Query parameter 'until' is required");
        }
        return recoveryService.protect(parse(hash), Instant.parse(until));
    }

    /**
     * Restores a deleted chunk. Send the content when the store no longer has it.
     */
    @POST
    @Path("/restore")
    @Consumes({MediaType.APPLICATION_OCTET_STREAM, MediaType.WILDCARD})
    public ChunkRecord restore(@PathParam("hash") String hash, byte[] content) {
        return recoveryService.restore(parse(hash), content != null && content.length > 0 ? content : null);
    }

    private static ContentHash parse(String hash) {
        return ContentHash.fromHex(hash);
    }
}
