package com.bsl.bankcode.retrieval;

import java.util.Collections;
import java.util.List;

public class RetrievalStageResult {
    private final List<ScoredCandidate> candidates;
    private final boolean error;
    private final boolean skipped;
    private final long tookMs;
    private final String errorMessage;

    private RetrievalStageResult(
        List<ScoredCandidate> candidates,
        boolean error,
        boolean skipped,
        long tookMs,
        String errorMessage
    ) {
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.error = error;
        this.skipped = skipped;
        this.tookMs = tookMs;
        this.errorMessage = errorMessage;
    }

    public static RetrievalStageResult success(List<ScoredCandidate> candidates, long tookMs) {
        return new RetrievalStageResult(candidates, false, false, tookMs, null);
    }

    public static RetrievalStageResult error(String message) {
        return new RetrievalStageResult(Collections.emptyList(), true, false, 0L, message);
    }

    public static RetrievalStageResult skipped(String reason) {
        return new RetrievalStageResult(Collections.emptyList(), false, true, 0L, reason);
    }

    public List<ScoredCandidate> getCandidates() {
        return candidates;
    }

    public boolean isError() {
        return error;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
