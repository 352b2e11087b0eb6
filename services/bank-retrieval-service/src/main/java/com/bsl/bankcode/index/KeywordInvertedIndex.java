package com.bsl.bankcode.index;

import com.bsl.bankcode.query.QueryText;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Character n-gram postings over compact bank names plus exact postings over
 * record keywords. A lookup picks the shortest posting list for the keyword and
 * verifies every candidate by substring, so results are exact.
 */
public class KeywordInvertedIndex {
    private static final int[] NO_POSTINGS = new int[0];

    private final long[] recordIds;
    private final String[] compactNames;
    private final Map<String, int[]> gramPostings;
    private final Map<String, int[]> keywordPostings;

    private KeywordInvertedIndex(long[] recordIds, String[] compactNames,
                                 Map<String, int[]> gramPostings, Map<String, int[]> keywordPostings) {
        this.recordIds = recordIds;
        this.compactNames = compactNames;
        this.gramPostings = gramPostings;
        this.keywordPostings = keywordPostings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static KeywordInvertedIndex empty() {
        return builder().build();
    }

    public int size() {
        return recordIds.length;
    }

    /**
     * Length of the longest posting list a lookup of this keyword would walk:
     * the shortest n-gram list or the exact keyword list. Cheap to compute and
     * meant to be checked before {@link #lookup(String)}.
     */
    public int postingSize(String keyword) {
        String key = QueryText.compact(keyword);
        if (key.isEmpty()) {
            return 0;
        }
        return Math.max(candidates(key).length, keywordPostings.getOrDefault(key, NO_POSTINGS).length);
    }

    /**
     * Ids of every record whose compact name contains the keyword or whose
     * keyword list holds it, in insertion order.
     */
    public List<Long> lookup(String keyword) {
        String key = QueryText.compact(keyword);
        if (key.isEmpty()) {
            return List.of();
        }
        Set<Integer> seen = new HashSet<>();
        List<Long> matches = new ArrayList<>();
        for (int slot : candidates(key)) {
            if (compactNames[slot].contains(key) && seen.add(slot)) {
                matches.add(recordIds[slot]);
            }
        }
        for (int slot : keywordPostings.getOrDefault(key, NO_POSTINGS)) {
            if (seen.add(slot)) {
                matches.add(recordIds[slot]);
            }
        }
        return matches;
    }

    private int[] candidates(String key) {
        int[] codePoints = key.codePoints().toArray();
        if (codePoints.length == 1) {
            return gramPostings.getOrDefault(gram(codePoints, 0, 1), NO_POSTINGS);
        }
        int[] shortest = null;
        for (int i = 0; i + 2 <= codePoints.length; i++) {
            int[] postings = gramPostings.get(gram(codePoints, i, 2));
            if (postings == null) {
                return NO_POSTINGS;
            }
            if (shortest == null || postings.length < shortest.length) {
                shortest = postings;
            }
        }
        return shortest == null ? NO_POSTINGS : shortest;
    }

    private static String gram(int[] codePoints, int start, int length) {
        return new String(codePoints, start, length);
    }

    public static final class Builder {
        private final List<Long> ids = new ArrayList<>();
        private final List<String> names = new ArrayList<>();
        private final Map<String, List<Integer>> grams = new HashMap<>();
        private final Map<String, List<Integer>> keywords = new HashMap<>();

        private Builder() {
        }

        public Builder add(long recordId, VectorMetadata metadata) {
            int slot = ids.size();
            String compact = metadata.getCompactName();
            ids.add(recordId);
            names.add(compact);
            int[] codePoints = compact.codePoints().toArray();
            for (int i = 0; i < codePoints.length; i++) {
                addPosting(grams, gram(codePoints, i, 1), slot);
                if (i + 2 <= codePoints.length) {
                    addPosting(grams, gram(codePoints, i, 2), slot);
                }
            }
            for (String keyword : metadata.getKeywords()) {
                addPosting(keywords, QueryText.compact(keyword).toLowerCase(Locale.ROOT), slot);
            }
            return this;
        }

        public KeywordInvertedIndex build() {
            long[] recordIds = new long[ids.size()];
            for (int i = 0; i < recordIds.length; i++) {
                recordIds[i] = ids.get(i);
            }
            return new KeywordInvertedIndex(
                recordIds,
                names.toArray(new String[0]),
                freeze(grams),
                freeze(keywords)
            );
        }

        private static void addPosting(Map<String, List<Integer>> postings, String key, int slot) {
            if (key.isEmpty()) {
                return;
            }
            List<Integer> list = postings.computeIfAbsent(key, k -> new ArrayList<>());
            if (list.isEmpty() || list.get(list.size() - 1) != slot) {
                list.add(slot);
            }
        }

        private static Map<String, int[]> freeze(Map<String, List<Integer>> source) {
            Map<String, int[]> frozen = new HashMap<>(source.size() * 2);
            for (Map.Entry<String, List<Integer>> entry : source.entrySet()) {
                List<Integer> slots = entry.getValue();
                int[] values = new int[slots.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = slots.get(i);
                }
                frozen.put(entry.getKey(), values);
            }
            return frozen;
        }
    }
}
