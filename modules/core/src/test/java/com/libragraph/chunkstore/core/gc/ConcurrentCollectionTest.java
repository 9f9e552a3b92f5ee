package com.libragraph.chunkstore.core.gc;

import com.libragraph.chunkstore.core.coordination.CollectorLease;
import com.libragraph.chunkstore.core.coordination.CoordinationException;
import com.libragraph.chunkstore.core.testutil.StoreFixture;
import com.libragraph.chunkstore.core.testutil.TestChunks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ConcurrentCollectionTest {

    private StoreFixture nodeA;
    private StoreFixture nodeB;

    @BeforeEach
    void setUp() {
        nodeA = StoreFixture.create();
        nodeB = nodeA.peer("node-b");
        for (int i = 0; i < 10; i++) {
            nodeA.write(TestChunks.of("orphan " + i));
        }
        nodeA.clock.advance(Duration.ofDays(8));
    }

    @Test
    void secondNodeIsTurnedAwayWhileFirstCollects() throws Exception {
        CountDownLatch firstHoldsLock = new CountDownLatch(1);
        CountDownLatch secondFinished = new CountDownLatch(1);
        nodeA.extraRoots.add(now -> {
            firstHoldsLock.countDown();
            try {
                if (!secondFinished.await(30, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("second node never finished");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return List.of();
        });

        CompletableFuture<CollectionResult> first = CompletableFuture.supplyAsync(() ->
                nodeA.collector.collect(CollectionRequest.manual(CollectionStrategy.MARK_AND_SWEEP, false)));
        assertThat(firstHoldsLock.await(30, TimeUnit.SECONDS)).isTrue();

        CollectionResult second = nodeB.collector.collect(
                CollectionRequest.manual(CollectionStrategy.MARK_AND_SWEEP, false));
        secondFinished.countDown();
        CollectionResult winner = first.get(30, TimeUnit.SECONDS);

        assertThat(second.lockAcquired()).isFalse();
        assertThat(second.runId()).isNull();
        assertThat(second.chunksScanned()).isZero();
        assertThat(second.chunksDeleted()).isZero();
        assertThat(second.lockHolder()).isEqualTo(nodeA.node.holderId());

        assertThat(winner.lockAcquired()).isTrue();
        assertThat(winner.chunksDeleted()).isEqualTo(10);
        assertThat(nodeA.deletions()).hasSize(10);
        assertThat(nodeB.deletions()).isEmpty();
        assertThat(nodeA.status.history(10)).hasSize(1);
    }

    @Test
    void parallelRunsNeverDeleteAChunkTwice() throws Exception {
        CollectionRequest request = CollectionRequest.manual(CollectionStrategy.REFERENCE_COUNT, false);

        CompletableFuture<CollectionResult> a = CompletableFuture.supplyAsync(() -> nodeA.collector.collect(request));
        CompletableFuture<CollectionResult> b = CompletableFuture.supplyAsync(() -> nodeB.collector.collect(request));
        CollectionResult ra = a.get(30, TimeUnit.SECONDS);
        CollectionResult rb = b.get(30, TimeUnit.SECONDS);

        assertThat(ra.chunksDeleted() + rb.chunksDeleted()).isEqualTo(10);
        assertThat(nodeA.deletions().size() + nodeB.deletions().size()).isEqualTo(10);
        for (CollectionResult r : List.of(ra, rb)) {
            if (!r.lockAcquired()) {
                assertThat(r.chunksScanned()).isZero();
                assertThat(r.chunksDeleted()).isZero();
            }
        }
        assertThat(nodeA.store.hashes()).isEmpty();
    }

    @Test
    void lockHeldElsewhereIsReportedWithHolder() {
        CollectorLease lease = nodeB.lock.tryAcquire(nodeB.node.holderId(), Duration.ofMinutes(10)).orElseThrow();

        CollectionResult result = nodeA.collector.collect(CollectionRequest.manual(null, false));

        assertThat(result.lockAcquired()).isFalse();
        assertThat(result.lockHolder()).isEqualTo(nodeB.node.holderId());
        assertThat(result.strategy()).isEqualTo(CollectionStrategy.REFERENCE_COUNT);
        assertThat(nodeA.store.hashes()).hasSize(10);
        assertThat(nodeB.lock.release(lease)).isTrue();
    }

    @Test
    void runAbortsWhenItsLeaseIsLost() {
        CollectorLease stale = nodeA.lock.tryAcquire(nodeA.node.holderId(), Duration.ofMinutes(10)).orElseThrow();
        nodeA.clock.advance(Duration.ofMinutes(11));
        nodeB.lock.tryAcquire(nodeB.node.holderId(), Duration.ofMinutes(10)).orElseThrow();

        assertThatThrownBy(() -> nodeA.collector.collectUnderLease(
                CollectionRequest.manual(CollectionStrategy.REFERENCE_COUNT, false), stale))
                .isInstanceOf(CoordinationException.class);

        assertThat(nodeA.status.history(1).get(0).status()).isEqualTo(GcRunStatus.FAILED);
        assertThat(nodeA.store.hashes()).hasSize(10);
    }
}
