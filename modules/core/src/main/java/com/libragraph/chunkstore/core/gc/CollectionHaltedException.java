package com.libragraph.chunkstore.core.gc;

public class CollectionHaltedException extends RuntimeException {

    public CollectionHaltedException(String reason) {
        super("Collection is halted: " + reason);
    }
}
