package com.bsl.bankcode.merge;

import com.bsl.bankcode.config.RetrievalConfig;
import com.bsl.bankcode.model.RetrievalMethod;
import com.bsl.bankcode.model.RetrievalResult;
import com.bsl.bankcode.query.QueryText;
import com.bsl.bankcode.retrieval.ScoredCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted linear fusion of vector similarity and keyword score, with a
 * deterministic tie-break on bank name.
 */
public final class ScoreFusion {
    private static final double SCORE_RESOLUTION = 1e9;

    private ScoreFusion() {
    }

    /**
     * @param excludedRecordId record already returned by the exact matcher, or {@code null}
     * @return fused results, best first, not truncated
     */
    public static List<RetrievalResult> fuse(
        List<ScoredCandidate> vectorCandidates,
        List<ScoredCandidate> keywordCandidates,
        RetrievalConfig config,
        double minFinalScore,
        String question,
        Long excludedRecordId
    ) {
        Map<Long, MutableCandidate> merged = new LinkedHashMap<>();
        for (ScoredCandidate candidate : vectorCandidates) {
            MutableCandidate entry = merged.computeIfAbsent(candidate.getRecordId(), id -> new MutableCandidate(candidate));
            entry.similarity = Math.max(entry.similarity, candidate.getSimilarityScore());
            entry.fromVector = true;
        }
        for (ScoredCandidate candidate : keywordCandidates) {
            MutableCandidate entry = merged.computeIfAbsent(candidate.getRecordId(), id -> new MutableCandidate(candidate));
            entry.similarity = Math.max(entry.similarity, candidate.getSimilarityScore());
            entry.keywordScore = Math.max(entry.keywordScore, candidate.getKeywordScore());
            entry.matchedKeywords = candidate.getMatchedKeywords();
        }

        boolean vectorOnly = !config.isEnableHybrid() && !vectorCandidates.isEmpty();
        List<MutableCandidate> kept = new ArrayList<>(merged.size());
        for (MutableCandidate entry : merged.values()) {
            if (excludedRecordId != null && entry.candidate.getRecordId() == excludedRecordId) {
                continue;
            }
            if (config.isEnableHybrid()) {
                entry.finalScore = config.getVectorWeight() * entry.similarity
                    + config.getKeywordWeight() * entry.keywordScore;
                entry.method = methodFor(entry.similarity, entry.keywordScore);
            } else if (vectorOnly) {
                if (!entry.fromVector) {
                    continue;
                }
                entry.finalScore = entry.similarity;
                entry.method = RetrievalMethod.VECTOR;
            } else {
                entry.finalScore = entry.keywordScore;
                entry.method = RetrievalMethod.KEYWORD;
            }
            if (entry.finalScore <= 0.0 || entry.finalScore < minFinalScore) {
                continue;
            }
            kept.add(entry);
        }

        String compactQuery = QueryText.compact(question);
        kept.sort(ranking(compactQuery));

        List<RetrievalResult> results = new ArrayList<>(kept.size());
        for (MutableCandidate entry : kept) {
            results.add(entry.toResult());
        }
        return results;
    }

    static RetrievalMethod methodFor(double similarity, double keywordScore) {
        if (similarity > 0.0 && keywordScore > 0.0) {
            return RetrievalMethod.HYBRID;
        }
        return similarity > 0.0 ? RetrievalMethod.VECTOR : RetrievalMethod.KEYWORD;
    }

    private static Comparator<MutableCandidate> ranking(String compactQuery) {
        Comparator<MutableCandidate> byScore = Comparator.comparingLong(
            (MutableCandidate entry) -> Math.round(entry.finalScore * SCORE_RESOLUTION)
        ).reversed();
        return byScore
            .thenComparing(entry -> !containsQuery(entry, compactQuery))
            .thenComparingInt(entry -> entry.candidate.getMetadata().getBankName().length())
            .thenComparing(entry -> entry.candidate.getMetadata().getBankCode());
    }

    private static boolean containsQuery(MutableCandidate entry, String compactQuery) {
        return !compactQuery.isEmpty() && entry.candidate.getMetadata().getCompactName().contains(compactQuery);
    }

    private static final class MutableCandidate {
        private final ScoredCandidate candidate;
        private double similarity;
        private double keywordScore;
        private double finalScore;
        private boolean fromVector;
        private RetrievalMethod method;
        private List<String> matchedKeywords = List.of();

        private MutableCandidate(ScoredCandidate candidate) {
            this.candidate = candidate;
        }

        private RetrievalResult toResult() {
            return new RetrievalResult(
                candidate.getRecordId(),
                candidate.getMetadata().getBankName(),
                candidate.getMetadata().getBankCode(),
                candidate.getMetadata().getClearingCode(),
                similarity,
                keywordScore,
                finalScore,
                method,
                matchedKeywords
            );
        }
    }
}
