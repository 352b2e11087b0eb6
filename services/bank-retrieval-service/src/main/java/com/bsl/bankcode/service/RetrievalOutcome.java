package com.bsl.bankcode.service;

import com.bsl.bankcode.model.RetrievalResult;
import java.util.List;

public final class RetrievalOutcome {
    private final List<RetrievalResult> results;
    private final long searchTimeMs;

    public RetrievalOutcome(List<RetrievalResult> results, long searchTimeMs) {
        this.results = results == null ? List.of() : List.copyOf(results);
        this.searchTimeMs = searchTimeMs;
    }

    public List<RetrievalResult> getResults() {
        return results;
    }

    /**
     * Number of results returned, after truncation.
     */
    public int getTotalFound() {
        return results.size();
    }

    public long getSearchTimeMs() {
        return searchTimeMs;
    }
}
