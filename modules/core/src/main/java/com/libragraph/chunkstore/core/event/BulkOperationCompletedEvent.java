package com.libragraph.chunkstore.core.event;

/**
 * Fired after an operation released many references at once (branch deletion,
 * history pruning). The scheduler answers with a follow-up collection.
 *
 * @param description    what ran, for logs
 * @param referencesRemoved number of references the operation released
 */
public record BulkOperationCompletedEvent(String description, int referencesRemoved) {
}
