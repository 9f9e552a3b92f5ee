package com.libragraph.chunkstore.core.status;

public record GcAlert(AlertKind kind, String message) {
}
