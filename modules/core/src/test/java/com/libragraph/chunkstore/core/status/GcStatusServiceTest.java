package com.libragraph.chunkstore.core.status;

import com.libragraph.chunkstore.core.coordination.CollectorLease;
import com.libragraph.chunkstore.core.gc.CollectionRequest;
import com.libragraph.chunkstore.core.gc.CollectionStrategy;
import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import com.libragraph.chunkstore.core.ledger.ReferenceSource;
import com.libragraph.chunkstore.core.testutil.StoreFixture;
import com.libragraph.chunkstore.core.testutil.TestChunks;
import com.libragraph.chunkstore.core.testutil.TestChunks.Chunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class GcStatusServiceTest {

    private static final ReferenceSource COMMIT = ReferenceSource.of(ReferenceKind.COMMIT, "c1");

    private StoreFixture fx;
    private GcStatusService service;

    @BeforeEach
    void setUp() {
        fx = StoreFixture.create();
        service = fx.status;
    }

    private void collect() {
        fx.collector.collect(CollectionRequest.manual(CollectionStrategy.REFERENCE_COUNT, false));
    }

    @Test
    void freshStoreHasNoAlerts() {
        GcStatus status = service.status();

        assertThat(status.lastRunAt()).isNull();
        assertThat(status.orphanedCount()).isZero();
        assertThat(status.pendingDeletionCount()).isZero();
        assertThat(status.lockHolder()).isNull();
        assertThat(status.halted()).isFalse();
        assertThat(status.alerts()).isEmpty();
    }

    @Test
    void countsOrphansAndPendingDeletions() {
        Chunk kept = TestChunks.of("kept content");
        fx.chunks.write(kept.hash(), kept.content(), COMMIT).await().indefinitely();
        Chunk a = TestChunks.of("a");
        Chunk b = TestChunks.of("bb");
        fx.write(a);
        fx.write(b);

        GcStatus status = service.status();

        assertThat(status.orphanedCount()).isEqualTo(2);
        assertThat(status.reclaimableBytes()).isEqualTo(a.content().length + b.content().length);
        assertThat(status.pendingDeletionCount()).isEqualTo(2);
    }

    @Test
    void reportsLockHolder() {
        CollectorLease lease = fx.lock.tryAcquire(fx.node.holderId(), Duration.ofMinutes(10)).orElseThrow();

        assertThat(service.status().lockHolder()).isEqualTo(fx.node.holderId());

        fx.lock.release(lease);
        assertThat(service.status().lockHolder()).isNull();
    }

    @Test
    void staleCollectionAlertAfterADayWithoutSuccess() {
        fx.clock.advance(Duration.ofHours(23));
        assertThat(service.alerts()).isEmpty();

        fx.clock.advance(Duration.ofHours(2));
        assertThat(service.alerts()).extracting(GcAlert::kind).containsExactly(AlertKind.STALE_COLLECTION);

        collect();
        assertThat(service.alerts()).isEmpty();
        assertThat(service.status().lastSuccessAt()).isEqualTo(fx.clock.instant());
    }

    @Test
    void dryRunsDoNotCountAsSuccess() {
        fx.recovery.emergencyHalt("maintenance");
        fx.collector.collect(CollectionRequest.manual(CollectionStrategy.REFERENCE_COUNT, true));
        fx.clock.advance(Duration.ofDays(2));

        assertThat(service.status().lastSuccessAt()).isNull();
        assertThat(service.alerts()).extracting(GcAlert::kind).contains(AlertKind.STALE_COLLECTION);
    }

    @Test
    void reclaimableFractionAlert() {
        Chunk kept = TestChunks.of("a fairly long chunk that stays referenced");
        fx.chunks.write(kept.hash(), kept.content(), COMMIT).await().indefinitely();
        fx.write(TestChunks.of("tiny"));
        assertThat(service.alerts()).isEmpty();

        fx.write(TestChunks.of("an orphan long enough to tip the reclaimable share over"));

        assertThat(service.alerts()).singleElement()
                .satisfies(alert -> assertThat(alert.kind()).isEqualTo(AlertKind.RECLAIMABLE_FRACTION));
    }

    @Test
    void historyIsNewestFirstAndClamped() {
        collect();
        fx.clock.advance(Duration.ofMinutes(1));
        collect();

        assertThat(service.history(0)).hasSize(1);
        assertThat(service.history(5000)).hasSize(2);
        assertThat(service.history(10).get(0).startedAt()).isEqualTo(fx.clock.instant());
    }
}
