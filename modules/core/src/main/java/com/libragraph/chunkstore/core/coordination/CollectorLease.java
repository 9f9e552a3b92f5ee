package com.libragraph.chunkstore.core.coordination;

import java.time.Instant;

/**
 * Proof of holding the collector lock. Only the holder of {@code token} may renew
 * or release it.
 */
public record CollectorLease(String key, String holder, String token, Instant acquiredAt, Instant expiresAt) {
}
