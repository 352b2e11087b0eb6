package com.bsl.bankcode.index;

import com.bsl.bankcode.embed.EmbeddingProvider;
import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.store.BankRecordChecksum;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeds records in batches and fills fresh indexes. Nothing is published here.
 */
public class IndexSnapshotBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexSnapshotBuilder.class);

    private final EmbeddingProvider embeddingProvider;
    private final int batchSize;
    private final Clock clock;

    public IndexSnapshotBuilder(EmbeddingProvider embeddingProvider, int batchSize, Clock clock) {
        this.embeddingProvider = embeddingProvider;
        this.batchSize = Math.max(1, batchSize);
        this.clock = clock;
    }

    public static String documentText(BankRecord record) {
        return "银行名称: " + record.getBankName()
            + " | 联行号: " + record.getBankCode()
            + " | 清算代码: " + record.getClearingCode();
    }

    public IndexSnapshot build(List<BankRecord> records) {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
        KeywordInvertedIndex.Builder keywordIndex = KeywordInvertedIndex.builder();
        int total = records.size();
        for (int start = 0; start < total; start += batchSize) {
            List<BankRecord> batch = records.subList(start, Math.min(total, start + batchSize));
            List<String> texts = new ArrayList<>(batch.size());
            for (BankRecord record : batch) {
                texts.add(documentText(record));
            }
            List<List<Double>> vectors = embeddingProvider.embedBatch(texts);
            if (vectors == null || vectors.size() != batch.size()) {
                throw new IllegalStateException(
                    "embedding batch returned " + (vectors == null ? 0 : vectors.size())
                        + " vectors for " + batch.size() + " records"
                );
            }
            for (int i = 0; i < batch.size(); i++) {
                BankRecord record = batch.get(i);
                VectorMetadata metadata = VectorMetadata.of(record, BankKeywordExtractor.extract(record.getBankName()));
                vectorIndex.upsert(record.getId(), vectors.get(i), metadata);
                keywordIndex.add(record.getId(), metadata);
            }
            int done = Math.min(total, start + batchSize);
            if (done == total || (done / batchSize) % 50 == 0) {
                logger.info("index_build_progress embedded={} total={}", done, total);
            }
        }
        return new IndexSnapshot(vectorIndex, keywordIndex.build(), BankRecordChecksum.of(records), clock.instant());
    }
}
