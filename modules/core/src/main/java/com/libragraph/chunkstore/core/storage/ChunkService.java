package com.libragraph.chunkstore.core.storage;

import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import com.libragraph.chunkstore.core.ledger.ReferenceSource;
import com.libragraph.chunkstore.util.ContentHash;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Write and read path for chunk payloads: the object store holds the bytes, the ledger
 * holds the bookkeeping. A write stores the bytes first, so a ledger row never claims
 * a payload the store has not accepted.
 */
@ApplicationScoped
public class ChunkService {

    private final ChunkStore store;
    private final ReferenceLedger ledger;

    @Inject
    public ChunkService(ChunkStore store, ReferenceLedger ledger) {
        this.store = store;
        this.ledger = ledger;
    }

    /**
     * Stores a chunk nothing references yet; its grace period starts now.
     */
    public Uni<ChunkRecord> write(ContentHash hash, byte[] content) {
        return write(hash, content, null);
    }

    /**
     * Stores a chunk and records {@code source} as its reference in the same ledger
     * transaction that registers it. Pass a pending-upload source to protect chunks of
     * an upload still in flight.
     */
    public Uni<ChunkRecord> write(ContentHash hash, byte[] content, ReferenceSource source) {
        return store.put(hash, content)
                .onItem().transform(v -> ledger.registerChunk(hash, content.length, null, StorageTier.HOT, source,
                        () -> store.put(hash, content).await().indefinitely()));
    }

    /**
     * Reads a payload and records the access time.
     *
     * @throws ChunkNotFoundException if the store does not hold the chunk
     */
    public Uni<byte[]> read(ContentHash hash) {
        return store.get(hash)
                .invoke(bytes -> ledger.touch(hash));
    }

    public Uni<Boolean> exists(ContentHash hash) {
        return store.exists(hash);
    }
}
