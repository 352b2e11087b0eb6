package com.bsl.bankcode.service;

import com.bsl.bankcode.config.RetrievalConfig;
import com.bsl.bankcode.config.RetrievalConfigService;
import com.bsl.bankcode.config.RetrievalProperties;
import com.bsl.bankcode.index.IndexSnapshot;
import com.bsl.bankcode.index.IndexSyncManager;
import com.bsl.bankcode.merge.ScoreFusion;
import com.bsl.bankcode.model.BankRecord;
import com.bsl.bankcode.model.RetrievalResult;
import com.bsl.bankcode.query.QueryEntities;
import com.bsl.bankcode.query.QueryEntityExtractor;
import com.bsl.bankcode.retrieval.ExactNameMatcher;
import com.bsl.bankcode.retrieval.KeywordMatcher;
import com.bsl.bankcode.retrieval.RetrievalStageResult;
import com.bsl.bankcode.retrieval.ScoredCandidate;
import com.bsl.bankcode.retrieval.VectorMatcher;
import com.bsl.bankcode.store.BankRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hybrid branch lookup: exact full-name shortcut, vector candidates, keyword
 * re-scoring and weighted fusion. Read-only; each call works against one index
 * snapshot and one config snapshot.
 */
@Service
public class BankRetrievalService {
    private static final Logger logger = LoggerFactory.getLogger(BankRetrievalService.class);

    private final QueryEntityExtractor entityExtractor;
    private final ExactNameMatcher exactNameMatcher;
    private final VectorMatcher vectorMatcher;
    private final KeywordMatcher keywordMatcher;
    private final IndexSyncManager indexSyncManager;
    private final RetrievalConfigService configService;
    private final RetrievalProperties properties;
    private final BankRecordStore recordStore;
    private final MeterRegistry meterRegistry;

    public BankRetrievalService(
        QueryEntityExtractor entityExtractor,
        ExactNameMatcher exactNameMatcher,
        VectorMatcher vectorMatcher,
        KeywordMatcher keywordMatcher,
        IndexSyncManager indexSyncManager,
        RetrievalConfigService configService,
        RetrievalProperties properties,
        BankRecordStore recordStore,
        MeterRegistry meterRegistry
    ) {
        this.entityExtractor = entityExtractor;
        this.exactNameMatcher = exactNameMatcher;
        this.vectorMatcher = vectorMatcher;
        this.keywordMatcher = keywordMatcher;
        this.indexSyncManager = indexSyncManager;
        this.configService = configService;
        this.properties = properties;
        this.recordStore = recordStore;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param topK optional override of the configured result count
     * @param similarityThreshold optional override of the configured vector threshold
     * @throws InvalidRetrievalRequestException on a blank question or out-of-range overrides
     */
    public RetrievalOutcome retrieve(String question, Integer topK, Double similarityThreshold) {
        if (question == null || question.isBlank()) {
            throw new InvalidRetrievalRequestException("question must not be blank");
        }
        if (topK != null && (topK < RetrievalConfig.MIN_TOP_K || topK > RetrievalConfig.MAX_TOP_K)) {
            throw new InvalidRetrievalRequestException(
                "top_k must be between " + RetrievalConfig.MIN_TOP_K + " and " + RetrievalConfig.MAX_TOP_K
            );
        }
        if (similarityThreshold != null
            && (similarityThreshold.isNaN() || similarityThreshold < 0.0 || similarityThreshold > 1.0)) {
            throw new InvalidRetrievalRequestException("similarity_threshold must be between 0 and 1");
        }

        RetrievalConfig config = configService.current();
        IndexSnapshot snapshot = indexSyncManager.snapshot();
        int effectiveTopK = topK == null ? config.getTopK() : topK;
        double threshold = similarityThreshold == null ? config.getSimilarityThreshold() : similarityThreshold;

        long started = System.nanoTime();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "ok";
        try {
            List<RetrievalResult> results = execute(question, snapshot, config, effectiveTopK, threshold);
            if (snapshot.isEmpty()) {
                outcome = "empty_index";
            } else if (results.isEmpty()) {
                outcome = "no_results";
            }
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            logger.debug(
                "retrieve_done top_k={} threshold={} results={} took_ms={}",
                effectiveTopK, threshold, results.size(), tookMs
            );
            return new RetrievalOutcome(results, tookMs);
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("bank_retrieval_latency"));
            meterRegistry.counter("bank_retrieval_requests_total", "outcome", outcome).increment();
        }
    }

    public Optional<BankRecord> findByCode(String bankCode) {
        if (!BankRecord.isValidCode(bankCode)) {
            return Optional.empty();
        }
        return recordStore.findByCode(bankCode);
    }

    private List<RetrievalResult> execute(
        String question,
        IndexSnapshot snapshot,
        RetrievalConfig config,
        int topK,
        double threshold
    ) {
        if (snapshot.isEmpty()) {
            logger.debug("retrieve_skipped reason=empty_index");
            return List.of();
        }
        QueryEntities entities = entityExtractor.extract(question);
        logger.debug("retrieve_entities entities={}", entities);

        Optional<RetrievalResult> exact = exactNameMatcher.match(entities, question);
        if (exact.isPresent() && properties.isExactShortCircuit()) {
            return List.of(exact.get());
        }

        RetrievalStageResult vector = vectorMatcher.match(question, snapshot, topK, threshold);
        if (vector.isError()) {
            meterRegistry.counter("bank_retrieval_stage_degraded_total", "stage", "vector").increment();
        }
        RetrievalStageResult keyword = keywordMatcher.match(entities, vector.getCandidates(), snapshot);
        if (keyword.isError()) {
            meterRegistry.counter("bank_retrieval_stage_degraded_total", "stage", "keyword").increment();
        }

        logger.debug(
            "retrieve_stages vector_candidates={} vector_took_ms={} keyword_candidates={} keyword_took_ms={}",
            vector.getCandidates().size(), vector.getTookMs(), keyword.getCandidates().size(), keyword.getTookMs()
        );

        List<ScoredCandidate> vectorCandidates = vector.getCandidates();
        List<ScoredCandidate> keywordCandidates = keyword.getCandidates();
        if (requiresKeywordAnchor(entities, keyword)) {
            Set<Long> anchored = keywordMatchedIds(keywordCandidates);
            vectorCandidates = retainIds(vectorCandidates, anchored);
            keywordCandidates = retainIds(keywordCandidates, anchored);
            logger.debug("retrieve_anchored vector_kept={} keyword_kept={}",
                vectorCandidates.size(), keywordCandidates.size());
        }

        List<RetrievalResult> fused = ScoreFusion.fuse(
            vectorCandidates,
            keywordCandidates,
            config,
            properties.getMinFinalScore(),
            question,
            exact.map(RetrievalResult::getRecordId).orElse(null)
        );

        List<RetrievalResult> results = new ArrayList<>(Math.min(topK, fused.size() + 1));
        exact.ifPresent(results::add);
        for (RetrievalResult result : fused) {
            if (results.size() >= topK) {
                break;
            }
            results.add(result);
        }
        return results;
    }

    /**
     * A query naming a place or branch keeps only candidates that match at
     * least one extracted keyword. Applies only when keyword scoring ran.
     */
    static boolean requiresKeywordAnchor(QueryEntities entities, RetrievalStageResult keyword) {
        if (keyword.isError() || keyword.isSkipped()) {
            return false;
        }
        return entities.getLocation().isPresent() || entities.getBranchName().isPresent();
    }

    private static Set<Long> keywordMatchedIds(List<ScoredCandidate> candidates) {
        Set<Long> ids = new HashSet<>();
        for (ScoredCandidate candidate : candidates) {
            if (candidate.getKeywordScore() > 0.0) {
                ids.add(candidate.getRecordId());
            }
        }
        return ids;
    }

    private static List<ScoredCandidate> retainIds(List<ScoredCandidate> candidates, Set<Long> ids) {
        List<ScoredCandidate> kept = new ArrayList<>(candidates.size());
        for (ScoredCandidate candidate : candidates) {
            if (ids.contains(candidate.getRecordId())) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
