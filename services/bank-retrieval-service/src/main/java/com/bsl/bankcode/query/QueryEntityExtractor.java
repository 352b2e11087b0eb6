package com.bsl.bankcode.query;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Pulls bank brand, city, branch and code hints out of a free-text question.
 * Recognised spans are blanked in a working copy so later steps only see the
 * residual text.
 */
@Component
public class QueryEntityExtractor {
    private static final Pattern CODE = Pattern.compile("(?<!\\d)(\\d{12})(?!\\d)");
    private static final Pattern BRANCH_RUN = Pattern.compile(
        "([^\\s银行]{2,12}?)(支行|分行|营业部|营业厅|分理处|储蓄所|网点)"
    );
    private static final Pattern SPACES = Pattern.compile("\\s+");

    public QueryEntities extract(String question) {
        String normalized = QueryText.normalize(question);
        if (normalized.isEmpty()) {
            return QueryEntities.empty();
        }
        QueryEntities.Builder builder = QueryEntities.builder();
        StringBuilder working = new StringBuilder(normalized.toLowerCase(Locale.ROOT));

        String codePattern = null;
        Matcher code = CODE.matcher(working);
        if (code.find()) {
            codePattern = code.group(1);
            builder.codePattern(codePattern);
            blank(working, code.start(1), code.end(1));
        }

        String compact = QueryText.compact(normalized);
        if (containsAny(compact, BankLexicon.CORPORATE_MARKERS) && containsAny(compact, BankLexicon.BRANCH_SUFFIXES)) {
            builder.fullName(normalized);
        }

        String alias = extractBrand(working, builder);
        if (alias != null) {
            builder.keyword(alias);
        }

        for (String marker : BankLexicon.CORPORATE_MARKERS) {
            blankAll(working, marker);
        }

        for (String city : BankLexicon.CITIES) {
            int idx = working.indexOf(city);
            if (idx >= 0) {
                builder.location(city);
                builder.keyword(city);
                blank(working, idx, idx + city.length());
                break;
            }
        }

        for (String stopword : BankLexicon.STOPWORDS) {
            blankAll(working, stopword);
        }

        Matcher branch = BRANCH_RUN.matcher(working);
        if (branch.find()) {
            String stem = branch.group(1);
            String run = stem + branch.group(2);
            builder.branchName(stem);
            builder.keyword(run);
            blank(working, branch.start(), branch.end());
        }

        for (String area : BankLexicon.COMMERCIAL_AREAS) {
            int idx = working.indexOf(area);
            if (idx < 0) {
                continue;
            }
            if (builder.getBranchName() == null) {
                builder.branchName(area);
            }
            if (builder.getLocation() == null && BankLexicon.LANDMARK_AREAS.contains(area)) {
                builder.location(area);
            }
            builder.keyword(area);
            blank(working, idx, idx + area.length());
        }

        if (codePattern != null) {
            builder.keyword(codePattern);
        }

        for (String token : SPACES.split(working.toString().trim())) {
            if (token.codePointCount(0, token.length()) < 2) {
                continue;
            }
            if (BankLexicon.isLatin(token) && BankLexicon.LATIN_STOPWORDS.contains(token)) {
                continue;
            }
            builder.keyword(token);
        }

        if (!builder.hasKeywords()) {
            for (String token : SPACES.split(normalized)) {
                builder.keyword(token);
            }
        }
        return builder.build();
    }

    private String extractBrand(StringBuilder working, QueryEntities.Builder builder) {
        for (String alias : BankLexicon.queryAliases()) {
            int idx = indexOfAlias(working, alias);
            if (idx < 0) {
                continue;
            }
            BankLexicon.Brand brand = BankLexicon.brandForAlias(alias);
            builder.bankType(alias);
            builder.brand(brand.getCanonical());
            blank(working, idx, idx + alias.length());
            return alias;
        }
        return null;
    }

    private int indexOfAlias(StringBuilder working, String alias) {
        if (!BankLexicon.isLatin(alias)) {
            return working.indexOf(alias);
        }
        String needle = alias.toLowerCase(Locale.ROOT);
        int from = 0;
        while (true) {
            int idx = working.indexOf(needle, from);
            if (idx < 0) {
                return -1;
            }
            int end = idx + needle.length();
            if (!isWordChar(working, idx - 1) && !isWordChar(working, end)) {
                return idx;
            }
            from = idx + 1;
        }
    }

    private static boolean isWordChar(CharSequence text, int index) {
        if (index < 0 || index >= text.length()) {
            return false;
        }
        char c = text.charAt(index);
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }

    private static boolean containsAny(String text, Iterable<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static void blankAll(StringBuilder working, String needle) {
        int idx = working.indexOf(needle);
        while (idx >= 0) {
            blank(working, idx, idx + needle.length());
            idx = working.indexOf(needle, idx + needle.length());
        }
    }

    private static void blank(StringBuilder working, int start, int end) {
        for (int i = start; i < end; i++) {
            working.setCharAt(i, ' ');
        }
    }
}
