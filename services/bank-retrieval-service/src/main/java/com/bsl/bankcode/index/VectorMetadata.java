package com.bsl.bankcode.index;

import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.query.QueryText;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.LinkedHashSet;

/**
 * Record fields copied into the index at build time, plus derived lookup forms.
 */
public final class VectorMetadata {
    private final String bankName;
    private final String bankCode;
    private final String clearingCode;
    private final String compactName;
    private final List<String> keywords;
    private final Set<String> keywordKeys;

    public VectorMetadata(String bankName, String bankCode, String clearingCode, List<String> keywords) {
        this.bankName = bankName;
        this.bankCode = bankCode;
        this.clearingCode = clearingCode;
        this.compactName = QueryText.compact(bankName);
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
        Set<String> keys = new LinkedHashSet<>();
        for (String keyword : this.keywords) {
            keys.add(keyword.toLowerCase(Locale.ROOT));
        }
        this.keywordKeys = Set.copyOf(keys);
    }

    public static VectorMetadata of(BankRecord record, List<String> keywords) {
        return new VectorMetadata(record.getBankName(), record.getBankCode(), record.getClearingCode(), keywords);
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

    public String getCompactName() {
        return compactName;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * True when the keyword is one of the record's precomputed keywords, compared case-insensitively.
     */
    public boolean hasKeyword(String keyword) {
        return keyword != null && keywordKeys.contains(keyword.toLowerCase(Locale.ROOT));
    }
}
