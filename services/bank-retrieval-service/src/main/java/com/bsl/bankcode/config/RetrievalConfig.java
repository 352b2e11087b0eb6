package com.bsl.bankcode.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Runtime-tunable retrieval knobs. Immutable; updates publish a new instance.
 */
public final class RetrievalConfig {
    public static final int MIN_TOP_K = 1;
    public static final int MAX_TOP_K = 50;
    public static final double WEIGHT_SUM_TOLERANCE = 0.01;

    @JsonProperty("similarity_threshold")
    private final double similarityThreshold;

    @JsonProperty("top_k")
    private final int topK;

    @JsonProperty("vector_weight")
    private final double vectorWeight;

    @JsonProperty("keyword_weight")
    private final double keywordWeight;

    @JsonProperty("enable_hybrid")
    private final boolean enableHybrid;

    public RetrievalConfig(double similarityThreshold, int topK, double vectorWeight, double keywordWeight,
                           boolean enableHybrid) {
        this.similarityThreshold = similarityThreshold;
        this.topK = topK;
        this.vectorWeight = vectorWeight;
        this.keywordWeight = keywordWeight;
        this.enableHybrid = enableHybrid;
    }

    public static RetrievalConfig from(RetrievalProperties.Defaults defaults) {
        return new RetrievalConfig(
            defaults.getSimilarityThreshold(),
            defaults.getTopK(),
            defaults.getVectorWeight(),
            defaults.getKeywordWeight(),
            defaults.isEnableHybrid()
        );
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int getTopK() {
        return topK;
    }

    public double getVectorWeight() {
        return vectorWeight;
    }

    public double getKeywordWeight() {
        return keywordWeight;
    }

    public boolean isEnableHybrid() {
        return enableHybrid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RetrievalConfig)) {
            return false;
        }
        RetrievalConfig that = (RetrievalConfig) o;
        return Double.compare(that.similarityThreshold, similarityThreshold) == 0
            && topK == that.topK
            && Double.compare(that.vectorWeight, vectorWeight) == 0
            && Double.compare(that.keywordWeight, keywordWeight) == 0
            && enableHybrid == that.enableHybrid;
    }

    @Override
    public int hashCode() {
        return Objects.hash(similarityThreshold, topK, vectorWeight, keywordWeight, enableHybrid);
    }

    @Override
    public String toString() {
        return "RetrievalConfig{similarityThreshold=" + similarityThreshold
            + ", topK=" + topK
            + ", vectorWeight=" + vectorWeight
            + ", keywordWeight=" + keywordWeight
            + ", enableHybrid=" + enableHybrid + "}";
    }
}
