package com.libragraph.chunkstore.core.gc;

public enum GcRunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
