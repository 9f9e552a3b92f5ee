package com.libragraph.chunkstore.api;

public record HaltRequest(String reason) {
}
