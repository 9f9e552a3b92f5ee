package com.libragraph.chunkstore.core.gc;

/**
 * A collection strategy: finds orphan candidates. Finders never delete; every
 * candidate goes through {@link ChunkReclaimer}.
 *
 * <p>Implementations are discovered as CDI beans, one per {@link CollectionStrategy}.
 */
public interface CandidateFinder {

    CollectionStrategy strategy();

    CandidateCursor open(CollectionContext context);
}
