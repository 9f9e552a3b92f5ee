package com.libragraph.chunkstore.core.storage;

import java.util.List;

/**
 * One page of a store listing, in ascending hash order.
 *
 * @param continuationToken opaque token for the next page, or null when the listing is exhausted
 */
public record ListingPage(List<StoredChunk> entries, String continuationToken) {

    public ListingPage {
        entries = List.copyOf(entries);
    }

    public boolean isLast() {
        return continuationToken == null;
    }
}
