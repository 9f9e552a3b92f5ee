package com.libragraph.chunkstore.core.audit;

import com.libragraph.chunkstore.core.dao.AuditRecord;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.gc.CollectionRequest;
import com.libragraph.chunkstore.core.gc.CollectionResult;
import com.libragraph.chunkstore.core.gc.CollectionStrategy;
import com.libragraph.chunkstore.core.gc.ConsistencyException;
import com.libragraph.chunkstore.core.ledger.ReferenceKind;
import com.libragraph.chunkstore.core.ledger.ReferenceSource;
import com.libragraph.chunkstore.core.storage.ChunkNotFoundException;
import com.libragraph.chunkstore.core.storage.ChunkValidationException;
import com.libragraph.chunkstore.core.testutil.StoreFixture;
import com.libragraph.chunkstore.core.testutil.TestChunks;
import com.libragraph.chunkstore.core.testutil.TestChunks.Chunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class RecoveryServiceTest {

    private StoreFixture fx;
    private RecoveryService recovery;

    @BeforeEach
    void setUp() {
        fx = StoreFixture.create();
        recovery = fx.recovery;
    }

    private CollectionResult collect() {
        return fx.collector.collect(CollectionRequest.manual(CollectionStrategy.REFERENCE_COUNT, false));
    }

    private Chunk collected(String text) {
        Chunk chunk = TestChunks.of(text);
        fx.write(chunk);
        fx.clock.advance(Duration.ofDays(8));
        assertThat(collect().candidates()).contains(chunk.hex());
        return chunk;
    }

    @Test
    void protectCancelsPendingDeletion() {
        Chunk a = TestChunks.of("chunk A");
        fx.write(a);
        Instant until = fx.clock.instant().plus(Duration.ofDays(30));

        ChunkRecord row = recovery.protect(a.hash(), until);

        assertThat(row.gcProtectedUntil()).isEqualTo(until);
        assertThat(fx.mark(a)).isEmpty();
        assertThat(fx.auditLog.forChunk(a.hex())).last()
                .satisfies(entry -> assertThat(entry.action()).isEqualTo(AuditAction.PROTECTED));

        fx.clock.advance(Duration.ofDays(8));
        assertThat(collect().candidates()).isEmpty();
        assertThat(fx.mark(a)).isEmpty();

        fx.clock.advance(Duration.ofDays(23));
        collect();
        assertThat(fx.mark(a)).hasValueSatisfying(mark ->
                assertThat(mark.deleteAfter()).isEqualTo(fx.clock.instant().plus(Duration.ofDays(7))));
        assertThat(fx.store.contains(a.hash())).isTrue();
    }

    @Test
    void protectionOutlastsRemovalOfTheLastReference() {
        Chunk a = TestChunks.of("chunk A");
        ReferenceSource commit = ReferenceSource.of(ReferenceKind.COMMIT, "c1");
        fx.chunks.write(a.hash(), a.content(), commit).await().indefinitely();
        Instant until = fx.clock.instant().plus(Duration.ofDays(365));
        recovery.protect(a.hash(), until);

        fx.ledger.decrementReference(a.hash(), commit);

        assertThat(fx.row(a).orElseThrow().gcProtectedUntil()).isEqualTo(until);
        assertThat(fx.mark(a)).isEmpty();
        assertThat(fx.auditLog.forChunk(a.hex())).last()
                .satisfies(entry -> assertThat(entry.action()).isEqualTo(AuditAction.SKIPPED));

        fx.clock.advance(Duration.ofDays(8));
        assertThat(collect().candidates()).isEmpty();
        CollectionResult urgent = fx.collector.collect(
                CollectionRequest.manual(CollectionStrategy.REFERENCE_COUNT, false)
                        .withGracePeriodOverride(Duration.ofHours(1)));
        assertThat(urgent.candidates()).isEmpty();
        assertThat(fx.mark(a)).isEmpty();
        assertThat(fx.store.contains(a.hash())).isTrue();

        fx.clock.advance(Duration.ofDays(358));
        collect();
        assertThat(fx.mark(a)).hasValueSatisfying(mark ->
                assertThat(mark.deleteAfter()).isEqualTo(fx.clock.instant().plus(Duration.ofDays(7))));

        fx.clock.advance(Duration.ofDays(8));
        assertThat(collect().candidates()).containsExactly(a.hex());
    }

    @Test
    void protectionSurvivesNewReferences() {
        Chunk a = TestChunks.of("chunk A");
        ReferenceSource first = ReferenceSource.of(ReferenceKind.COMMIT, "c1");
        ReferenceSource second = ReferenceSource.of(ReferenceKind.COMMIT, "c2");
        fx.chunks.write(a.hash(), a.content(), first).await().indefinitely();
        Instant until = fx.clock.instant().plus(Duration.ofDays(90));
        recovery.protect(a.hash(), until);

        fx.ledger.incrementReference(a.hash(), second);

        assertThat(fx.row(a).orElseThrow().gcProtectedUntil()).isEqualTo(until);
    }

    @Test
    void protectKeepsLaterExistingProtection() {
        Chunk a = TestChunks.of("chunk A");
        fx.write(a);
        Instant later = fx.clock.instant().plus(Duration.ofDays(30));
        recovery.protect(a.hash(), later);

        ChunkRecord row = recovery.protect(a.hash(), fx.clock.instant().plus(Duration.ofDays(10)));

        assertThat(row.gcProtectedUntil()).isEqualTo(later);
    }

    @Test
    void protectRejectsBadInput() {
        Chunk a = TestChunks.of("chunk A");
        fx.write(a);

        assertThatThrownBy(() -> recovery.protect(a.hash(), fx.clock.instant()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> recovery.protect(TestChunks.of("unknown").hash(),
                fx.clock.instant().plusSeconds(60)))
                .isInstanceOf(ChunkNotFoundException.class);

        Chunk gone = collected("chunk B");
        assertThatThrownBy(() -> recovery.protect(gone.hash(), fx.clock.instant().plusSeconds(60)))
                .isInstanceOf(ConsistencyException.class);
    }

    @Test
    void restoreReuploadsDeletedChunk() {
        Chunk a = collected("chunk A");
        assertThat(fx.store.contains(a.hash())).isFalse();

        ChunkRecord row = recovery.restore(a.hash(), a.content());

        assertThat(row.isDeleted()).isFalse();
        assertThat(row.sizeBytes()).isEqualTo(a.content().length);
        assertThat(fx.store.contains(a.hash())).isTrue();
        assertThat(fx.mark(a)).hasValueSatisfying(mark ->
                assertThat(mark.deleteAfter()).isEqualTo(fx.clock.instant().plus(Duration.ofDays(7))));
        assertThat(fx.auditLog.forChunk(a.hex())).extracting(AuditRecord::action)
                .containsExactly(AuditAction.MARKED, AuditAction.DELETED, AuditAction.MARKED, AuditAction.RESTORED);
    }

    @Test
    void restoreOfRowWhoseBytesSurvived() {
        Chunk a = TestChunks.of("chunk A");
        fx.write(a);
        fx.jdbi.useHandle(h -> h.createUpdate("UPDATE chunk SET deleted_at = :now WHERE hash = :hash")
                .bind("now", fx.clock.instant())
                .bind("hash", a.hex())
                .execute());

        ChunkRecord row = recovery.restore(a.hash(), null);

        assertThat(row.isDeleted()).isFalse();
        assertThat(fx.auditLog.forChunk(a.hex())).last()
                .satisfies(entry -> assertThat(entry.reason()).isEqualTo("ledger row restored"));
    }

    @Test
    void restoreOfLiveChunkIsNoOp() {
        Chunk a = TestChunks.of("chunk A");
        ChunkRecord written = fx.write(a);

        assertThat(recovery.restore(a.hash(), null)).isEqualTo(written);
        assertThat(fx.auditLog.forChunk(a.hex())).extracting(AuditRecord::action)
                .containsExactly(AuditAction.MARKED);
    }

    @Test
    void restoreNeedsContentOnceBytesAreGone() {
        Chunk a = collected("chunk A");

        assertThatThrownBy(() -> recovery.restore(a.hash(), null))
                .isInstanceOf(ConsistencyException.class);
        assertThatThrownBy(() -> recovery.restore(a.hash(), "forged".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(ChunkValidationException.class);
        assertThatThrownBy(() -> recovery.restore(TestChunks.of("never written").hash(), null))
                .isInstanceOf(ChunkNotFoundException.class);
        assertThat(fx.row(a).orElseThrow().isDeleted()).isTrue();
    }

    @Test
    void purgeRemovesRowsOlderThanRecoveryWindow() {
        Chunk a = collected("chunk A");

        fx.clock.advance(Duration.ofDays(29));
        assertThat(recovery.purgeExpired()).isZero();

        fx.clock.advance(Duration.ofDays(2));
        assertThat(recovery.purgeExpired()).isEqualTo(1);

        assertThat(fx.row(a)).isEmpty();
        assertThat(fx.auditLog.forChunk(a.hex())).last()
                .satisfies(entry -> assertThat(entry.action()).isEqualTo(AuditAction.PURGED));
        assertThat(recovery.purgeExpired()).isZero();
    }

    @Test
    void haltDropsAllMarksAndResumeRestartsGrace() {
        Chunk a = TestChunks.of("chunk A");
        Chunk b = TestChunks.of("chunk B");
        fx.write(a);
        fx.write(b);
        fx.clock.advance(Duration.ofDays(8));

        assertThat(recovery.emergencyHalt("bad deploy")).isEqualTo(2);

        assertThat(fx.status.status().halted()).isTrue();
        assertThat(fx.status.status().haltedReason()).isEqualTo("bad deploy");
        assertThat(fx.status.status().pendingDeletionCount()).isZero();
        assertThat(fx.auditLog.recent(1)).singleElement()
                .satisfies(entry -> assertThat(entry.action()).isEqualTo(AuditAction.HALTED));

        recovery.resume();
        CollectionResult afterResume = collect();

        assertThat(fx.status.status().halted()).isFalse();
        assertThat(afterResume.candidates()).isEmpty();
        assertThat(fx.store.hashes()).contains(a.hex(), b.hex());
        assertThat(fx.mark(a)).hasValueSatisfying(mark ->
                assertThat(mark.deleteAfter()).isEqualTo(fx.clock.instant().plus(Duration.ofDays(7))));
    }
}
