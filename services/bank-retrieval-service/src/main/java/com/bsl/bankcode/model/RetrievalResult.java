package com.bsl.bankcode.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One ranked answer. Immutable once produced.
 */
public final class RetrievalResult {
    @JsonProperty("record_id")
    private final long recordId;

    @JsonProperty("bank_name")
    private final String bankName;

    @JsonProperty("bank_code")
    private final String bankCode;

    @JsonProperty("clearing_code")
    private final String clearingCode;

    @JsonProperty("similarity_score")
    private final double similarityScore;

    @JsonProperty("keyword_score")
    private final double keywordScore;

    @JsonProperty("final_score")
    private final double finalScore;

    @JsonProperty("retrieval_method")
    private final RetrievalMethod retrievalMethod;

    @JsonProperty("matched_keywords")
    private final List<String> matchedKeywords;

    public RetrievalResult(
        long recordId,
        String bankName,
        String bankCode,
        String clearingCode,
        double similarityScore,
        double keywordScore,
        double finalScore,
        RetrievalMethod retrievalMethod,
        List<String> matchedKeywords
    ) {
        this.recordId = recordId;
        this.bankName = bankName;
        this.bankCode = bankCode;
        this.clearingCode = clearingCode;
        this.similarityScore = similarityScore;
        this.keywordScore = keywordScore;
        this.finalScore = finalScore;
        this.retrievalMethod = retrievalMethod;
        this.matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public long getRecordId() {
        return recordId;
    }

    public String getBankName() {
        return bankName;
    }

    public String getBankCode() {
        return bankCode;
    }

    public String getClearingCode() {
        return clearingCode;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public double getKeywordScore() {
        return keywordScore;
    }

    public double getFinalScore() {
        return finalScore;
    }

    public RetrievalMethod getRetrievalMethod() {
        return retrievalMethod;
    }

    public List<String> getMatchedKeywords() {
        return matchedKeywords;
    }
}
