package com.bsl.bankcode.retrieval;

import com.bsl.bankcode.config.RetrievalProperties;
import com.bsl.bankcode.index.BankKeywordExtractor;
import com.bsl.bankcode.index.IndexSnapshot;
import com.bsl.bankcode.index.KeywordInvertedIndex;
import com.bsl.bankcode.index.VectorMetadata;
import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.query.QueryEntities;
import com.bsl.bankcode.query.QueryText;
import com.bsl.bankcode.store.BankRecordStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores a restricted candidate set by the share of query keywords each record
 * matches. Candidates are the vector hits, the record owning a quoted code and
 * the best inverted-index hits; the corpus is never scanned per query.
 */
@Component
public class KeywordMatcher {
    private static final Logger logger = LoggerFactory.getLogger(KeywordMatcher.class);

    private final BankRecordStore recordStore;
    private final RetrievalProperties properties;

    public KeywordMatcher(BankRecordStore recordStore, RetrievalProperties properties) {
        this.recordStore = recordStore;
        this.properties = properties;
    }

    public RetrievalStageResult match(QueryEntities entities, List<ScoredCandidate> vectorCandidates,
                                      IndexSnapshot snapshot) {
        List<String> keywords = entities.getKeywords();
        if (keywords.isEmpty()) {
            return RetrievalStageResult.skipped("no_keywords");
        }
        long started = System.nanoTime();
        try {
            Map<Long, ScoredCandidate> pool = collectCandidates(entities, vectorCandidates, snapshot);
            List<ScoredCandidate> scored = new ArrayList<>(pool.size());
            for (ScoredCandidate candidate : pool.values()) {
                List<String> matched = matchedKeywords(keywords, candidate.getMetadata());
                double score = (double) matched.size() / keywords.size();
                scored.add(candidate.withKeywordScore(score, matched));
            }
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            logger.debug("keyword_stage_done keywords={} candidates={} took_ms={}", keywords.size(), scored.size(), tookMs);
            return RetrievalStageResult.success(scored, tookMs);
        } catch (RuntimeException e) {
            logger.warn("keyword_stage_degraded reason={}", e.getMessage(), e);
            return RetrievalStageResult.error("keyword_stage_failure");
        }
    }

    /**
     * Keywords found in the record: substring of the compact name, equal to the
     * bank code, or one of the record's precomputed keywords.
     */
    public static List<String> matchedKeywords(List<String> keywords, VectorMetadata metadata) {
        List<String> matched = new ArrayList<>();
        String compactName = metadata.getCompactName();
        for (String keyword : keywords) {
            String key = QueryText.compact(keyword);
            if (key.isEmpty()) {
                continue;
            }
            if (compactName.contains(key) || keyword.equals(metadata.getBankCode()) || metadata.hasKeyword(keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    private Map<Long, ScoredCandidate> collectCandidates(QueryEntities entities, List<ScoredCandidate> vectorCandidates,
                                                         IndexSnapshot snapshot) {
        Map<Long, ScoredCandidate> pool = new LinkedHashMap<>();
        for (ScoredCandidate candidate : vectorCandidates) {
            pool.putIfAbsent(candidate.getRecordId(), candidate);
        }

        Optional<String> code = entities.getCodePattern();
        if (code.isPresent()) {
            lookupCode(code.get()).ifPresent(record ->
                pool.computeIfAbsent(record.getId(), id -> keywordOnly(record, snapshot))
            );
        }

        KeywordInvertedIndex keywordIndex = snapshot.getKeywordIndex();
        if (keywordIndex.size() > 0) {
            for (Long id : invertedIndexHits(entities.getKeywords(), keywordIndex)) {
                if (pool.containsKey(id)) {
                    continue;
                }
                snapshot.getVectorIndex().metadata(id)
                    .ifPresent(metadata -> pool.put(id, new ScoredCandidate(id, metadata, 0.0, 0.0, List.of())));
            }
        } else if (vectorCandidates.isEmpty()) {
            for (BankRecord record : recordStore.head(properties.getKeyword().getFallbackScanLimit())) {
                pool.computeIfAbsent(record.getId(), id -> keywordOnly(record, snapshot));
            }
        }
        return pool;
    }

    private List<Long> invertedIndexHits(List<String> keywords, KeywordInvertedIndex keywordIndex) {
        int maxPostings = properties.getKeyword().getMaxPostingsPerKeyword();
        Map<Long, Integer> hitCounts = new HashMap<>();
        for (String keyword : keywords) {
            int postings = keywordIndex.postingSize(keyword);
            if (postings > maxPostings) {
                logger.debug("keyword_postings_skipped keyword={} postings={}", keyword, postings);
                continue;
            }
            for (Long id : keywordIndex.lookup(keyword)) {
                hitCounts.merge(id, 1, Integer::sum);
            }
        }
        List<Map.Entry<Long, Integer>> ranked = new ArrayList<>(hitCounts.entrySet());
        ranked.sort(
            Map.Entry.<Long, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey())
        );
        int limit = Math.min(ranked.size(), Math.max(0, properties.getKeyword().getMaxKeywordCandidates()));
        List<Long> ids = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            ids.add(ranked.get(i).getKey());
        }
        return ids;
    }

    private Optional<BankRecord> lookupCode(String code) {
        try {
            return recordStore.findByCode(code);
        } catch (RuntimeException e) {
            logger.warn("keyword_code_lookup_failed code={} reason={}", code, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static ScoredCandidate keywordOnly(BankRecord record, IndexSnapshot snapshot) {
        VectorMetadata metadata = snapshot.getVectorIndex().metadata(record.getId())
            .orElseGet(() -> VectorMetadata.of(record, BankKeywordExtractor.extract(record.getBankName())));
        return new ScoredCandidate(record.getId(), metadata, 0.0, 0.0, List.of());
    }
}
