package com.bsl.bankcode.index;

import com.bsl.bankcode.store.BankRecordChecksum;
import java.time.Instant;

/**
 * Immutable pairing of the vector index and keyword index built from one
 * record set. Retrieval reads exactly one snapshot per call.
 */
public final class IndexSnapshot {
    private static final IndexSnapshot EMPTY = new IndexSnapshot(
        new InMemoryVectorIndex(), KeywordInvertedIndex.empty(), BankRecordChecksum.EMPTY, null
    );

    private final VectorIndex vectorIndex;
    private final KeywordInvertedIndex keywordIndex;
    private final String checksum;
    private final Instant builtAt;

    public IndexSnapshot(VectorIndex vectorIndex, KeywordInvertedIndex keywordIndex, String checksum, Instant builtAt) {
        this.vectorIndex = vectorIndex;
        this.keywordIndex = keywordIndex;
        this.checksum = checksum;
        this.builtAt = builtAt;
    }

    public static IndexSnapshot empty() {
        return EMPTY;
    }

    public VectorIndex getVectorIndex() {
        return vectorIndex;
    }

    public KeywordInvertedIndex getKeywordIndex() {
        return keywordIndex;
    }

    public String getChecksum() {
        return checksum;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public int getVectorCount() {
        return vectorIndex.count();
    }

    public int getDimension() {
        return vectorIndex.dimension();
    }

    public boolean isEmpty() {
        return vectorIndex.count() == 0;
    }
}
