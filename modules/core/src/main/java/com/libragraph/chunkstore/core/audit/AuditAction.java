package com.libragraph.chunkstore.core.audit;

public enum AuditAction {
    MARKED,
    RESURRECTED,
    EXPIRED,
    DELETED,
    SKIPPED,
    FAILED,
    PROTECTED,
    RESTORED,
    PURGED,
    HALTED,
    RESUMED
}
