package com.bsl.bankcode.index;

import com.bsl.bankcode.query.BankLexicon;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the keywords stored with each indexed record: the full name, brand
 * aliases, cities, branch types and special-area markers found in the name.
 */
public final class BankKeywordExtractor {
    private static final int MIN_KEYWORD_LENGTH = 2;

    private BankKeywordExtractor() {
    }

    public static List<String> extract(String bankName) {
        if (bankName == null || bankName.isBlank()) {
            return List.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        keywords.add(bankName.trim());

        BankLexicon.Brand brand = BankLexicon.brandOfBankName(bankName);
        if (brand != null) {
            keywords.addAll(brand.allNames());
        }
        for (String city : BankLexicon.CITIES) {
            if (bankName.contains(city)) {
                keywords.add(city);
            }
        }
        for (String area : BankLexicon.COMMERCIAL_AREAS) {
            if (bankName.contains(area)) {
                keywords.add(area);
            }
        }
        for (String type : BankLexicon.BRANCH_TYPES) {
            if (bankName.contains(type)) {
                keywords.add(type);
            }
        }
        for (String area : BankLexicon.SPECIAL_AREAS) {
            if (bankName.contains(area)) {
                keywords.add(area);
            }
        }

        List<String> result = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            if (keyword.codePointCount(0, keyword.length()) >= MIN_KEYWORD_LENGTH) {
                result.add(keyword);
            }
        }
        return result;
    }
}
