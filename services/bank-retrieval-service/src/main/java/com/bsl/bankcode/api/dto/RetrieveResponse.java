package com.bsl.bankcode.api.dto;

import com.bsl.bankcode.model.RetrievalResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class RetrieveResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    private String question;
    private List<RetrievalResult> results;

    @JsonProperty("total_found")
    private int totalFound;

    @JsonProperty("search_time_ms")
    private long searchTimeMs;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public List<RetrievalResult> getResults() {
        return results;
    }

    public void setResults(List<RetrievalResult> results) {
        this.results = results;
    }

    public int getTotalFound() {
        return totalFound;
    }

    public void setTotalFound(int totalFound) {
        this.totalFound = totalFound;
    }

    public long getSearchTimeMs() {
        return searchTimeMs;
    }

    public void setSearchTimeMs(long searchTimeMs) {
        this.searchTimeMs = searchTimeMs;
    }
}
