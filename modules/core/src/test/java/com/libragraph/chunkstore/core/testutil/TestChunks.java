package com.libragraph.chunkstore.core.testutil;

import com.libragraph.chunkstore.util.ContentHash;

import java.nio.charset.StandardCharsets;

public final class TestChunks {

    private TestChunks() {
    }

    public record Chunk(ContentHash hash, byte[] content) {
        public String hex() {
            return hash.toHex();
        }
    }

    public static Chunk of(String text) {
        byte[] content = text.getBytes(StandardCharsets.UTF_8);
        return new Chunk(ContentHash.of(content), content);
    }
}
