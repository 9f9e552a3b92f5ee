package com.libragraph.chunkstore.core.gc;

/**
 * The ledger and the object store (or the roots) disagree about a chunk.
 */
public class ConsistencyException extends RuntimeException {

    public ConsistencyException(String message) {
        super(message);
    }
}
