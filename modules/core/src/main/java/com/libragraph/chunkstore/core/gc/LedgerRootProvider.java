package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.dao.ReferenceDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.Collection;

/**
 * Roots recorded in the ledger: every live reference, except pending uploads whose
 * expiry has passed.
 */
@ApplicationScoped
public class LedgerRootProvider implements RootProvider {

    private final Jdbi jdbi;

    @Inject
    public LedgerRootProvider(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public Collection<String> reachableHashes(Instant now) {
        return jdbi.withExtension(ReferenceDao.class, dao -> dao.findLiveChunkHashes(now));
    }
}
