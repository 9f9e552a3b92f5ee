package com.libragraph.chunkstore.util;

import org.apache.commons.codec.digest.Blake3;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a BLAKE3-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>The lowercase hex form is the storage key and the ledger primary key.
 * Lexical order of the hex form equals unsigned byte order, so {@link #compareTo}
 * and string comparison agree; it is the order in which chunk locks are taken.
 */
public record ContentHash(byte[] bytes) implements Comparable<ContentHash> {
    public static final int HASH_LENGTH = 32; // 256 bits
    public static final int HEX_LENGTH = HASH_LENGTH * 2;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (BLAKE3-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Computes the hash of the given content.
     */
    public static ContentHash of(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        return new ContentHash(Blake3.hash(content));
    }

    /**
     * Creates ContentHash from hex string (64 characters).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HEX_LENGTH) {
            throw new IllegalArgumentException(
                "BLAKE3-256 hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns true if {@code hex} is a well-formed lowercase 64-character digest.
     */
    public static boolean isHex(String hex) {
        if (hex == null || hex.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    /**
     * True if this hash is the digest of {@code content}.
     */
    public boolean matches(byte[] content) {
        return Arrays.equals(bytes, Blake3.hash(content));
    }

    @Override
    public int compareTo(ContentHash other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
