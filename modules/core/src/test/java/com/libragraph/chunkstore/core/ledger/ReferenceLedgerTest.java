package com.libragraph.chunkstore.core.ledger;

import com.libragraph.chunkstore.core.audit.AuditAction;
import com.libragraph.chunkstore.core.audit.PriorSourceCodec;
import com.libragraph.chunkstore.core.dao.AuditRecord;
import com.libragraph.chunkstore.core.dao.ChunkRecord;
import com.libragraph.chunkstore.core.storage.ChunkValidationException;
import com.libragraph.chunkstore.core.storage.StorageTier;
import com.libragraph.chunkstore.core.testutil.StoreFixture;
import com.libragraph.chunkstore.core.testutil.TestChunks;
import com.libragraph.chunkstore.core.testutil.TestChunks.Chunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ReferenceLedgerTest {

    private StoreFixture fx;
    private ReferenceLedger ledger;

    @BeforeEach
    void setUp() {
        fx = StoreFixture.create();
        ledger = fx.ledger;
    }

    private static ReferenceSource commit(String id) {
        return ReferenceSource.of(ReferenceKind.COMMIT, id, "repo-1");
    }

    private List<AuditAction> actions(Chunk chunk) {
        return fx.auditLog.forChunk(chunk.hex()).stream().map(AuditRecord::action).toList();
    }

    @Test
    void increment_createsRowWithCountOne() {
        Chunk a = TestChunks.of("alpha");

        assertThat(ledger.incrementReference(a.hash(), commit("c1"))).isTrue();

        ChunkRecord row = fx.row(a).orElseThrow();
        assertThat(row.refCount()).isEqualTo(1);
        assertThat(row.sizeBytes()).isZero();
        assertThat(fx.mark(a)).isEmpty();
        assertThat(ledger.references(a.hash())).singleElement()
                .satisfies(ref -> {
                    assertThat(ref.sourceKind()).isEqualTo(ReferenceKind.COMMIT);
                    assertThat(ref.sourceId()).isEqualTo("c1");
                    assertThat(ref.repositoryId()).isEqualTo("repo-1");
                });
    }

    @Test
    void increment_sameSourceTwice_countsOnce() {
        Chunk a = TestChunks.of("alpha");

        ledger.incrementReference(a.hash(), commit("c1"));
        assertThat(ledger.incrementReference(a.hash(), commit("c1"))).isFalse();

        assertThat(fx.row(a).orElseThrow().refCount()).isEqualTo(1);
    }

    @Test
    void increment_sameIdDifferentKinds_countsBoth() {
        Chunk a = TestChunks.of("alpha");

        ledger.incrementReference(a.hash(), ReferenceSource.of(ReferenceKind.COMMIT, "x"));
        ledger.incrementReference(a.hash(), ReferenceSource.of(ReferenceKind.TAG, "x"));

        assertThat(fx.row(a).orElseThrow().refCount()).isEqualTo(2);
    }

    @Test
    void decrementToZero_startsGracePeriodAndRecordsPriorSource() {
        Chunk a = TestChunks.of("alpha");
        fx.chunks.write(a.hash(), a.content(), commit("c1")).await().indefinitely();

        fx.clock.advance(Duration.ofHours(1));
        assertThat(ledger.decrementReference(a.hash(), commit("c1"))).isTrue();

        ChunkRecord row = fx.row(a).orElseThrow();
        assertThat(row.refCount()).isZero();
        assertThat(row.gcProtectedUntil()).isEqualTo(fx.clock.instant().plus(Duration.ofDays(7)));
        var mark = fx.mark(a).orElseThrow();
        assertThat(mark.markedAt()).isEqualTo(fx.clock.instant());
        assertThat(mark.deleteAfter()).isEqualTo(fx.clock.instant().plus(Duration.ofDays(7)));

        var priorSources = new PriorSourceCodec(new ObjectMapper()).decode(mark.priorSources());
        assertThat(priorSources).singleElement()
                .satisfies(s -> {
                    assertThat(s.kind()).isEqualTo(ReferenceKind.COMMIT);
                    assertThat(s.sourceId()).isEqualTo("c1");
                });
        assertThat(actions(a)).containsExactly(AuditAction.MARKED);
    }

    @Test
    void decrement_missingReference_isNoOpAndNeverNegative() {
        Chunk a = TestChunks.of("alpha");
        ledger.incrementReference(a.hash(), commit("c1"));

        assertThat(ledger.decrementReference(a.hash(), commit("c2"))).isFalse();
        assertThat(ledger.decrementReference(a.hash(), commit("c1"))).isTrue();
        assertThat(ledger.decrementReference(a.hash(), commit("c1"))).isFalse();

        assertThat(fx.row(a).orElseThrow().refCount()).isZero();
        assertThat(ledger.decrementReference(TestChunks.of("never seen").hash(), commit("c1"))).isFalse();
    }

    @Test
    void decrement_withOtherReferencesLeft_doesNotMark() {
        Chunk a = TestChunks.of("alpha");
        ledger.incrementReference(a.hash(), commit("c1"));
        ledger.incrementReference(a.hash(), commit("c2"));

        ledger.decrementReference(a.hash(), commit("c1"));

        assertThat(fx.row(a).orElseThrow().refCount()).isEqualTo(1);
        assertThat(fx.mark(a)).isEmpty();
    }

    @Test
    void incrementAfterOrphaning_removesMarkAndAuditsResurrection() {
        Chunk a = TestChunks.of("alpha");
        ledger.incrementReference(a.hash(), commit("c1"));
        ledger.decrementReference(a.hash(), commit("c1"));
        assertThat(fx.mark(a)).isPresent();

        ledger.incrementReference(a.hash(), ReferenceSource.of(ReferenceKind.STAGING_ENTRY, "index:a"));

        assertThat(fx.mark(a)).isEmpty();
        ChunkRecord row = fx.row(a).orElseThrow();
        assertThat(row.refCount()).isEqualTo(1);
        assertThat(row.gcProtectedUntil()).isNull();
        assertThat(actions(a)).containsExactly(AuditAction.MARKED, AuditAction.RESURRECTED);
    }

    @Test
    void reapExpiredUploads_releasesOnlyExpiredUploadReferences() {
        Chunk a = TestChunks.of("alpha");
        Chunk b = TestChunks.of("beta");
        Chunk c = TestChunks.of("gamma");
        ReferenceSource expired = ReferenceSource.pendingUpload("upload-1", "repo-1",
                StoreFixture.START.plus(Duration.ofHours(1)));
        ReferenceSource open = ReferenceSource.pendingUpload("upload-2", "repo-1",
                StoreFixture.START.plus(Duration.ofDays(1)));
        fx.chunks.write(a.hash(), a.content(), expired).await().indefinitely();
        fx.chunks.write(b.hash(), b.content(), expired).await().indefinitely();
        ledger.incrementReference(b.hash(), commit("c1"));
        fx.chunks.write(c.hash(), c.content(), open).await().indefinitely();
        fx.clock.advance(Duration.ofHours(2));

        assertThat(ledger.reapExpiredUploads(null)).isEqualTo(2);

        assertThat(fx.row(a).orElseThrow().refCount()).isZero();
        assertThat(fx.mark(a)).hasValueSatisfying(mark -> {
            assertThat(mark.deleteAfter()).isEqualTo(fx.clock.instant().plus(Duration.ofDays(7)));
            assertThat(new PriorSourceCodec(new ObjectMapper()).decode(mark.priorSources())).singleElement()
                    .satisfies(source -> assertThat(source.sourceId()).isEqualTo("upload-1"));
        });
        assertThat(actions(a)).containsExactly(AuditAction.EXPIRED, AuditAction.MARKED);
        assertThat(fx.row(b).orElseThrow().refCount()).isEqualTo(1);
        assertThat(fx.mark(b)).isEmpty();
        assertThat(fx.row(c).orElseThrow().refCount()).isEqualTo(1);
        assertThat(ledger.reapExpiredUploads(null)).isZero();
    }

    @Test
    void writeWithoutReference_startsGracePeriodImmediately() {
        Chunk a = TestChunks.of("alpha");

        ChunkRecord row = fx.write(a);

        assertThat(row.refCount()).isZero();
        assertThat(row.sizeBytes()).isEqualTo(a.content().length);
        assertThat(fx.mark(a)).hasValueSatisfying(mark ->
                assertThat(mark.deleteAfter()).isEqualTo(StoreFixture.START.plus(Duration.ofDays(7))));
    }

    @Test
    void writeWithPendingUpload_isReferencedInSameTransaction() {
        Chunk a = TestChunks.of("alpha");
        ReferenceSource upload = ReferenceSource.pendingUpload("upload-7", "repo-1",
                StoreFixture.START.plus(Duration.ofHours(2)));

        ChunkRecord row = fx.chunks.write(a.hash(), a.content(), upload).await().indefinitely();

        assertThat(row.refCount()).isEqualTo(1);
        assertThat(fx.mark(a)).isEmpty();
        assertThat(ledger.references(a.hash())).singleElement()
                .satisfies(ref -> assertThat(ref.expiresAt()).isEqualTo(StoreFixture.START.plus(Duration.ofHours(2))));
    }

    @Test
    void referenceBeforeWrite_fillsSizeWhenWritten() {
        Chunk a = TestChunks.of("alpha");
        ledger.incrementReference(a.hash(), commit("c1"));

        ChunkRecord row = fx.write(a);

        assertThat(row.refCount()).isEqualTo(1);
        assertThat(row.sizeBytes()).isEqualTo(a.content().length);
        assertThat(fx.mark(a)).isEmpty();
    }

    @Test
    void batchIncrement_deduplicatesHashes() {
        Chunk a = TestChunks.of("alpha");
        Chunk b = TestChunks.of("beta");

        int added = ledger.incrementReferences(List.of(b.hash(), a.hash(), b.hash()), commit("c1"));

        assertThat(added).isEqualTo(2);
        assertThat(fx.row(a).orElseThrow().refCount()).isEqualTo(1);
        assertThat(fx.row(b).orElseThrow().refCount()).isEqualTo(1);
    }

    @Test
    void removeSource_releasesEveryChunkItHeld() {
        Chunk a = TestChunks.of("alpha");
        Chunk b = TestChunks.of("beta");
        Chunk c = TestChunks.of("gamma");
        ledger.incrementReferences(List.of(a.hash(), b.hash()), ReferenceSource.of(ReferenceKind.STASH, "stash@{0}"));
        ledger.incrementReference(c.hash(), ReferenceSource.of(ReferenceKind.STASH, "stash@{1}"));

        int removed = ledger.removeSource(ReferenceKind.STASH, "stash@{0}");

        assertThat(removed).isEqualTo(2);
        assertThat(fx.mark(a)).isPresent();
        assertThat(fx.mark(b)).isPresent();
        assertThat(fx.mark(c)).isEmpty();
        assertThat(fx.row(c).orElseThrow().refCount()).isEqualTo(1);
    }

    @Test
    void referenceSource_rejectsInvalidInput() {
        assertThatThrownBy(() -> ReferenceSource.of(ReferenceKind.COMMIT, " "))
                .isInstanceOf(ChunkValidationException.class);
        assertThatThrownBy(() -> new ReferenceSource(ReferenceKind.TAG, "v1", null, StoreFixture.START))
                .isInstanceOf(ChunkValidationException.class);
        assertThatThrownBy(() -> ReferenceSource.of(null, "x"))
                .isInstanceOf(ChunkValidationException.class);
    }

    @Test
    void changeTierAndTouch_updateMetadataOnly() {
        Chunk a = TestChunks.of("alpha");
        ledger.incrementReference(a.hash(), commit("c1"));
        fx.clock.advance(Duration.ofMinutes(5));

        assertThat(ledger.changeTier(a.hash(), StorageTier.COLD)).isTrue();
        ledger.touch(a.hash());

        ChunkRecord row = fx.row(a).orElseThrow();
        assertThat(row.storageTier()).isEqualTo(StorageTier.COLD);
        assertThat(row.lastAccessedAt()).isEqualTo(fx.clock.instant());
        assertThat(row.refCount()).isEqualTo(1);
    }

    @Test
    void concurrentIncrementsAndDecrements_onOneChunk_areSerialized() throws Exception {
        Chunk a = TestChunks.of("contended");
        fx.write(a);
        int sources = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> increments = new ArrayList<>();
            for (int i = 0; i < sources; i++) {
                ReferenceSource source = commit("c" + i);
                increments.add(() -> ledger.incrementReference(a.hash(), source));
            }
            for (Future<Boolean> f : pool.invokeAll(increments)) {
                assertThat(f.get()).isTrue();
            }
            assertThat(fx.row(a).orElseThrow().refCount()).isEqualTo(sources);
            assertThat(fx.mark(a)).isEmpty();

            List<Callable<Boolean>> decrements = new ArrayList<>();
            for (int i = 0; i < sources; i++) {
                ReferenceSource source = commit("c" + i);
                decrements.add(() -> ledger.decrementReference(a.hash(), source));
            }
            for (Future<Boolean> f : pool.invokeAll(decrements)) {
                assertThat(f.get()).isTrue();
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(fx.row(a).orElseThrow().refCount()).isZero();
        assertThat(fx.mark(a)).isPresent();
        assertThat(ledger.references(a.hash())).isEmpty();
    }
}
