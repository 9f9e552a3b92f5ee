package com.libragraph.chunkstore.core.audit;

/**
 * One audit row to append. Built fluently:
 * {@code AuditEntry.of(AuditAction.DELETED, hex).size(n).run(runId).reason("...")}.
 */
public record AuditEntry(
        AuditAction action,
        String chunkHash,
        Long sizeBytes,
        Long gcRunId,
        String priorSources,
        String reason
) {

    public static AuditEntry of(AuditAction action, String chunkHash) {
        return new AuditEntry(action, chunkHash, null, null, null, null);
    }

    public static AuditEntry of(AuditAction action) {
        return of(action, null);
    }

    public AuditEntry size(long bytes) {
        return new AuditEntry(action, chunkHash, bytes, gcRunId, priorSources, reason);
    }

    public AuditEntry run(Long runId) {
        return new AuditEntry(action, chunkHash, sizeBytes, runId, priorSources, reason);
    }

    public AuditEntry sources(String priorSourcesJson) {
        return new AuditEntry(action, chunkHash, sizeBytes, gcRunId, priorSourcesJson, reason);
    }

    public AuditEntry reason(String text) {
        String bounded = text != null && text.length() > 1000 ? text.substring(0, 1000) : text;
        return new AuditEntry(action, chunkHash, sizeBytes, gcRunId, priorSources, bounded);
    }
}
