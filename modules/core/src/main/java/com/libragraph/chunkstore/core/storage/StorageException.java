package com.libragraph.chunkstore.core.storage;

/**
 * Wraps checked I/O exceptions from object store operations.
 * Treated as transient by the collector, which retries with backoff.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
