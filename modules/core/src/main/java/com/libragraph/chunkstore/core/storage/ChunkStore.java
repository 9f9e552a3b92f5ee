package com.libragraph.chunkstore.core.storage;

import com.libragraph.chunkstore.util.ContentHash;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/**
 * Content-addressed object store holding chunk payloads under their hex hash.
 *
 * <p>Objects are immutable: a hash is written at most once and never overwritten.
 * Every operation is independent per chunk, so callers may run many of them
 * concurrently.
 */
public interface ChunkStore {

    int DEFAULT_PAGE_SIZE = 1000;

    /**
     * Stores a chunk. Writing a hash that is already present is a successful no-op.
     *
     * @throws ChunkValidationException if {@code content} does not hash to {@code hash}
     * @throws StorageException on I/O errors
     */
    Uni<Void> put(ContentHash hash, byte[] content);

    /**
     * Reads a chunk's payload.
     *
     * @throws ChunkNotFoundException if the chunk does not exist
     * @throws StorageException on I/O errors
     */
    Uni<byte[]> get(ContentHash hash);

    /**
     * Removes a chunk. Deleting an absent hash is a successful no-op, so a
     * retried delete never fails.
     *
     * @throws StorageException on I/O errors
     */
    Uni<Void> delete(ContentHash hash);

    /**
     * Checks whether a chunk exists.
     */
    Uni<Boolean> exists(ContentHash hash);

    /**
     * Lists one page of chunks whose hex hash starts with {@code prefix}.
     *
     * @param prefix            hex prefix, empty for all chunks
     * @param continuationToken token from the previous page, or null for the first page
     * @param maxKeys           page size
     */
    Uni<ListingPage> list(String prefix, String continuationToken, int maxKeys);

    /**
     * Lazily lists every chunk under {@code prefix}, following continuation tokens.
     * Pages are fetched only as the stream is consumed.
     */
    default Multi<StoredChunk> list(String prefix) {
        return pagesFrom(prefix, null)
                .onItem().transformToIterable(ListingPage::entries);
    }

    private Multi<ListingPage> pagesFrom(String prefix, String continuationToken) {
        return list(prefix, continuationToken, DEFAULT_PAGE_SIZE).toMulti()
                .onItem().transformToMultiAndConcatenate(page -> page.isLast()
                        ? Multi.createFrom().item(page)
                        : Multi.createBy().concatenating().streams(
                                Multi.createFrom().item(page),
                                pagesFrom(prefix, page.continuationToken())));
    }

    /**
     * Throws {@link ChunkValidationException} unless {@code content} hashes to {@code hash}.
     */
    static void verify(ContentHash hash, byte[] content) {
        if (content == null) {
            throw new ChunkValidationException("Chunk content is null: " + hash);
        }
        ContentHash actual = ContentHash.of(content);
        if (!actual.equals(hash)) {
            throw new ChunkValidationException(
                    "Content hash mismatch: expected " + hash + ", got " + actual);
        }
    }
}
