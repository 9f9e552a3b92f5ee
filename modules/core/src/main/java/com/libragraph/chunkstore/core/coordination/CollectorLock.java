package com.libragraph.chunkstore.core.coordination;

import java.time.Duration;
import java.util.Optional;

/**
 * Cluster-wide mutual exclusion for collection passes.
 *
 * <p>A lease expires on its own, so a crashed holder is superseded once its TTL
 * passes. Renewal and release only succeed for the token that acquired the lease.
 */
public interface CollectorLock {

    /**
     * Acquires the lock if it is free or its lease has expired.
     *
     * @return the lease, or empty when another holder has a live lease
     */
    Optional<CollectorLease> tryAcquire(String holder, Duration ttl);

    /**
     * Extends a live lease.
     *
     * @return false if the lease already expired or was taken over
     */
    boolean renew(CollectorLease lease, Duration ttl);

    /**
     * Releases the lease if {@code lease} still owns it; a stale lease is ignored.
     *
     * @return true if this call released the lock
     */
    boolean release(CollectorLease lease);

    /**
     * Holder of the current live lease, if any.
     */
    Optional<String> currentHolder();
}
