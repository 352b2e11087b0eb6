package com.bsl.bankcode.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public final class IndexStats {
    @JsonProperty("vector_db_count")
    private final int vectorDbCount;

    @JsonProperty("source_db_count")
    private final int sourceDbCount;

    @JsonProperty("is_synced")
    private final boolean synced;

    @JsonProperty("embedding_dimension")
    private final int embeddingDimension;

    @JsonProperty("built_at")
    private final Instant builtAt;

    @JsonProperty("source_checksum")
    private final String sourceChecksum;

    @JsonProperty("index_checksum")
    private final String indexChecksum;

    public IndexStats(int vectorDbCount, int sourceDbCount, boolean synced, int embeddingDimension,
                      Instant builtAt, String sourceChecksum, String indexChecksum) {
        this.vectorDbCount = vectorDbCount;
        this.sourceDbCount = sourceDbCount;
        this.synced = synced;
        this.embeddingDimension = embeddingDimension;
        this.builtAt = builtAt;
        this.sourceChecksum = sourceChecksum;
        this.indexChecksum = indexChecksum;
    }

    public int getVectorDbCount() {
        return vectorDbCount;
    }

    public int getSourceDbCount() {
        return sourceDbCount;
    }

    public boolean isSynced() {
        return synced;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public String getSourceChecksum() {
        return sourceChecksum;
    }

    public String getIndexChecksum() {
        return indexChecksum;
    }
}
