package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.ledger.ReferenceLedger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;

/**
 * Default strategy: every zero-reference chunk whose grace period has elapsed.
 */
@ApplicationScoped
public class ReferenceCountCandidateFinder extends LedgerCandidateFinder {

    @Inject
    public ReferenceCountCandidateFinder(Jdbi jdbi, Clock clock, ReferenceLedger ledger) {
        super(jdbi, clock, ledger);
    }

    @Override
    public CollectionStrategy strategy() {
        return CollectionStrategy.REFERENCE_COUNT;
    }

    @Override
    protected CreationWindow window(CollectionContext context, Instant now) {
        return new CreationWindow(Instant.EPOCH, FAR_FUTURE, true);
    }
}
