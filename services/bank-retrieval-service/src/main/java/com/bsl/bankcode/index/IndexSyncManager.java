package com.bsl.bankcode.index;

import com.bsl.bankcode.embed.EmbeddingProvider;
import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.store.BankRecordStore;
import com.bsl.bankcode.store.StoreFingerprint;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Owns the published {@link IndexSnapshot}. Rebuilds run one at a time, build
 * off to the side and swap the reference only on success.
 */
@Service
public class IndexSyncManager {
    private static final Logger logger = LoggerFactory.getLogger(IndexSyncManager.class);

    private final BankRecordStore recordStore;
    private final IndexSnapshotBuilder snapshotBuilder;
    private final ExecutorService rebuildExecutor;
    private final MeterRegistry meterRegistry;
    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>(IndexSnapshot.empty());
    private final ReentrantLock rebuildLock = new ReentrantLock();

    @Autowired
    public IndexSyncManager(
        BankRecordStore recordStore,
        EmbeddingProvider embeddingProvider,
        IndexProperties properties,
        @Qualifier("indexRebuildExecutor") ExecutorService rebuildExecutor,
        MeterRegistry meterRegistry
    ) {
        this(
            recordStore,
            new IndexSnapshotBuilder(embeddingProvider, properties.getBatchSize(), Clock.systemUTC()),
            rebuildExecutor,
            meterRegistry
        );
    }

    IndexSyncManager(
        BankRecordStore recordStore,
        IndexSnapshotBuilder snapshotBuilder,
        ExecutorService rebuildExecutor,
        MeterRegistry meterRegistry
    ) {
        this.recordStore = recordStore;
        this.snapshotBuilder = snapshotBuilder;
        this.rebuildExecutor = rebuildExecutor;
        this.meterRegistry = meterRegistry;
    }

    public IndexSnapshot snapshot() {
        return current.get();
    }

    /**
     * Rebuilds the index from the record store.
     *
     * @return {@code true} when a snapshot in sync with the store is published afterwards,
     *     {@code false} when the store is empty
     * @throws IndexRebuildException when embedding or indexing fails; the previous snapshot stays live
     */
    public boolean rebuild(boolean force) {
        rebuildLock.lock();
        try {
            if (!force && isSynced(current.get(), recordStore.fingerprint())) {
                logger.info("index_rebuild_skipped reason=already_synced count={}", current.get().getVectorCount());
                meterRegistry.counter("bank_index_rebuilds_total", "outcome", "skipped").increment();
                return true;
            }
            List<BankRecord> records = recordStore.getAll();
            if (records.isEmpty()) {
                logger.warn("index_rebuild_skipped reason=empty_store");
                meterRegistry.counter("bank_index_rebuilds_total", "outcome", "empty_store").increment();
                return false;
            }
            long started = System.nanoTime();
            logger.info("index_rebuild_started records={} force={}", records.size(), force);
            IndexSnapshot next;
            try {
                next = snapshotBuilder.build(records);
            } catch (RuntimeException e) {
                logger.error("index_rebuild_failed records={} reason={}", records.size(), e.getMessage(), e);
                meterRegistry.counter("bank_index_rebuilds_total", "outcome", "failed").increment();
                throw new IndexRebuildException("index rebuild failed: " + e.getMessage(), e);
            }
            current.set(next);
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            logger.info(
                "index_rebuild_completed vectors={} dimension={} took_ms={}",
                next.getVectorCount(), next.getDimension(), tookMs
            );
            meterRegistry.counter("bank_index_rebuilds_total", "outcome", "completed").increment();
            return true;
        } finally {
            rebuildLock.unlock();
        }
    }

    public CompletableFuture<Boolean> rebuildAsync(boolean force) {
        return CompletableFuture.supplyAsync(() -> rebuild(force), rebuildExecutor);
    }

    public IndexStats stats() {
        IndexSnapshot snapshot = current.get();
        StoreFingerprint source = recordStore.fingerprint();
        return new IndexStats(
            snapshot.getVectorCount(),
            source.getCount(),
            isSynced(snapshot, source),
            snapshot.getDimension(),
            snapshot.getBuiltAt(),
            source.getChecksum(),
            snapshot.getChecksum()
        );
    }

    private static boolean isSynced(IndexSnapshot snapshot, StoreFingerprint source) {
        return snapshot.getVectorCount() > 0
            && snapshot.getVectorCount() == source.getCount()
            && snapshot.getChecksum().equals(source.getChecksum());
    }
}
