package com.bsl.bankcode.retrieval;

import com.bsl.bankcode.index.VectorMetadata;
import java.util.List;

/**
 * A record carried between stages together with the scores gathered so far.
 */
public final class ScoredCandidate {
    private final long recordId;
    private final VectorMetadata metadata;
    private final double similarityScore;
    private final double keywordScore;
    private final List<String> matchedKeywords;

    public ScoredCandidate(long recordId, VectorMetadata metadata, double similarityScore, double keywordScore,
                           List<String> matchedKeywords) {
        this.recordId = recordId;
        this.metadata = metadata;
        this.similarityScore = similarityScore;
        this.keywordScore = keywordScore;
        this.matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public static ScoredCandidate vector(long recordId, VectorMetadata metadata, double similarityScore) {
        return new ScoredCandidate(recordId, metadata, similarityScore, 0.0, List.of());
    }

    public ScoredCandidate withKeywordScore(double score, List<String> matched) {
        return new ScoredCandidate(recordId, metadata, similarityScore, score, matched);
    }

    public long getRecordId() {
        return recordId;
    }

    public VectorMetadata getMetadata() {
        return metadata;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public double getKeywordScore() {
        return keywordScore;
    }

    public List<String> getMatchedKeywords() {
        return matchedKeywords;
    }
}
