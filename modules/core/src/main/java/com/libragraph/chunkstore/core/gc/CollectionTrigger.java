package com.libragraph.chunkstore.core.gc;

public enum CollectionTrigger {
    SCHEDULED,
    PRESSURE,
    MANUAL,
    BULK_FOLLOWUP
}
