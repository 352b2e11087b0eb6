package com.bsl.bankcode.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bsl.bankcode.BankRecordFixtures;
import com.bsl.bankcode.embed.EmbeddingProvider;
import com.bsl.bankcode.embed.EmbeddingUnavailableException;
import com.bsl.bankcode.embed.ToyEmbedder;
import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.store.BankRecordStore;
import com.bsl.bankcode.store.InMemoryBankRecordStore;
import com.bsl.bankcode.store.StoreFingerprint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IndexSyncManagerTest {
    private final ToyEmbedder toyEmbedder = new ToyEmbedder(64);
    private final AtomicInteger batchCalls = new AtomicInteger();
    private final AtomicBoolean failEmbedding = new AtomicBoolean(false);
    private final EmbeddingProvider provider = new EmbeddingProvider() {
        @Override
        public List<Double> embed(String text) {
            return toyEmbedder.embed(text);
        }

        @Override
        public List<List<Double>> embedBatch(List<String> texts) {
            batchCalls.incrementAndGet();
            if (failEmbedding.get()) {
                throw new EmbeddingUnavailableException("embed_unavailable");
            }
            return EmbeddingProvider.super.embedBatch(texts);
        }
    };

    private InMemoryBankRecordStore store;
    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private IndexSyncManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryBankRecordStore(BankRecordFixtures.records());
        executor = Executors.newSingleThreadExecutor();
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        manager = new IndexSyncManager(store, new IndexSnapshotBuilder(provider, 5, clock), executor, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void emptyIndexIsNotSynced() {
        IndexStats stats = manager.stats();

        assertThat(stats.getVectorDbCount()).isZero();
        assertThat(stats.getSourceDbCount()).isEqualTo(14);
        assertThat(stats.isSynced()).isFalse();
        assertThat(manager.snapshot().isEmpty()).isTrue();
    }

    @Test
    void rebuildEmbedsInBatchesAndSyncs() {
        assertThat(manager.rebuild(false)).isTrue();

        IndexStats stats = manager.stats();
        assertThat(stats.getVectorDbCount()).isEqualTo(14);
        assertThat(stats.isSynced()).isTrue();
        assertThat(stats.getEmbeddingDimension()).isEqualTo(64);
        assertThat(stats.getIndexChecksum()).isEqualTo(stats.getSourceChecksum());
        assertThat(batchCalls.get()).isEqualTo(3);
        assertThat(manager.snapshot().getKeywordIndex().size()).isEqualTo(14);
    }

    @Test
    void unforcedRebuildOfSyncedIndexDoesNoWork() {
        manager.rebuild(false);
        IndexSnapshot first = manager.snapshot();

        assertThat(manager.rebuild(false)).isTrue();

        assertThat(manager.snapshot()).isSameAs(first);
        assertThat(batchCalls.get()).isEqualTo(3);
        assertThat(meterRegistry.counter("bank_index_rebuilds_total", "outcome", "skipped").count()).isEqualTo(1.0);
    }

    @Test
    void forcedRebuildIsIdempotent() {
        manager.rebuild(true);
        IndexStats first = manager.stats();
        List<VectorHit> firstHits = manager.snapshot().getVectorIndex().query(toyEmbedder.embed("工商银行西单"), 5);

        manager.rebuild(true);
        IndexStats second = manager.stats();
        List<VectorHit> secondHits = manager.snapshot().getVectorIndex().query(toyEmbedder.embed("工商银行西单"), 5);

        assertThat(second.getVectorDbCount()).isEqualTo(first.getVectorDbCount());
        assertThat(second.getSourceDbCount()).isEqualTo(first.getSourceDbCount());
        assertThat(second.isSynced()).isEqualTo(first.isSynced());
        assertThat(second.getEmbeddingDimension()).isEqualTo(first.getEmbeddingDimension());
        assertThat(second.getIndexChecksum()).isEqualTo(first.getIndexChecksum());
        assertThat(secondHits).extracting(VectorHit::getRecordId)
            .containsExactlyElementsOf(firstHits.stream().map(VectorHit::getRecordId).toList());
    }

    @Test
    void failedRebuildKeepsPreviousSnapshot() {
        manager.rebuild(false);
        IndexSnapshot live = manager.snapshot();
        failEmbedding.set(true);

        assertThatThrownBy(() -> manager.rebuild(true))
            .isInstanceOf(IndexRebuildException.class)
            .hasCauseInstanceOf(EmbeddingUnavailableException.class);

        assertThat(manager.snapshot()).isSameAs(live);
        assertThat(manager.stats().isSynced()).isTrue();
        assertThat(meterRegistry.counter("bank_index_rebuilds_total", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void sourceDriftIsDetected() {
        manager.rebuild(false);
        List<BankRecord> changed = new ArrayList<>(BankRecordFixtures.records());
        changed.set(1, BankRecord.of(2L, "中国建设银行股份有限公司北京西单北大街支行", "105100000017", "105100000017"));
        store.replaceAll(changed);

        assertThat(manager.stats().isSynced()).isFalse();
        assertThat(manager.stats().getVectorDbCount()).isEqualTo(manager.stats().getSourceDbCount());

        assertThat(manager.rebuild(false)).isTrue();
        assertThat(manager.stats().isSynced()).isTrue();
    }

    @Test
    void emptyStoreLeavesSnapshotUntouched() {
        manager.rebuild(false);
        IndexSnapshot live = manager.snapshot();
        store.replaceAll(List.of());

        assertThat(manager.rebuild(true)).isFalse();
        assertThat(manager.snapshot()).isSameAs(live);
    }

    @Test
    void asyncRebuildCompletesOnExecutor() throws Exception {
        Boolean built = manager.rebuildAsync(false).get(10, TimeUnit.SECONDS);

        assertThat(built).isTrue();
        assertThat(manager.stats().isSynced()).isTrue();
    }

    @Test
    void statsReadCountAndChecksumFromOneFingerprint() {
        manager.rebuild(false);
        BankRecordStore source = mock(BankRecordStore.class);
        when(source.fingerprint()).thenReturn(new StoreFingerprint(14, manager.snapshot().getChecksum()));
        IndexSyncManager observed = new IndexSyncManager(
            source, new IndexSnapshotBuilder(provider, 5, Clock.systemUTC()), executor, meterRegistry
        );

        IndexStats stats = observed.stats();

        assertThat(stats.getSourceDbCount()).isEqualTo(14);
        assertThat(stats.getSourceChecksum()).isEqualTo(manager.snapshot().getChecksum());
        verify(source).fingerprint();
        verify(source, never()).count();
        verify(source, never()).getAll();
    }
}
