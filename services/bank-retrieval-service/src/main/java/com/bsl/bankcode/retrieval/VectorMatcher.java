package com.bsl.bankcode.retrieval;

import com.bsl.bankcode.config.RetrievalProperties;
import com.bsl.bankcode.embed.EmbeddingProvider;
import com.bsl.bankcode.embed.EmbeddingUnavailableException;
import com.bsl.bankcode.index.IndexSnapshot;
import com.bsl.bankcode.index.VectorHit;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Semantic candidates from the vector index. Failures degrade to an error
 * stage result; this matcher never throws.
 */
@Component
public class VectorMatcher {
    private static final Logger logger = LoggerFactory.getLogger(VectorMatcher.class);

    private final EmbeddingProvider embeddingProvider;
    private final RetrievalProperties properties;

    public VectorMatcher(EmbeddingProvider embeddingProvider, RetrievalProperties properties) {
        this.embeddingProvider = embeddingProvider;
        this.properties = properties;
    }

    /**
     * Cosine similarity recovered from the squared L2 distance between unit
     * vectors ({@code cos = 1 - d/2}), clamped to [0, 1]. Orthogonal or opposed
     * vectors score 0, so the threshold can cut unrelated records.
     */
    public static double similarity(double squaredDistance) {
        double cosine = 1.0 - Math.max(0.0, squaredDistance) / 2.0;
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    public RetrievalStageResult match(String question, IndexSnapshot snapshot, int topK, double threshold) {
        if (question == null || question.isBlank() || snapshot == null || snapshot.isEmpty()) {
            return RetrievalStageResult.skipped("vector_not_applicable");
        }
        long started = System.nanoTime();
        int poolSize = properties.getVector().poolSize(topK);
        List<VectorHit> hits;
        try {
            List<Double> vector = embeddingProvider.embed(question);
            hits = snapshot.getVectorIndex().query(vector, poolSize);
        } catch (EmbeddingUnavailableException e) {
            logger.warn("vector_stage_degraded reason=embedding_unavailable detail={}", e.getMessage());
            return RetrievalStageResult.error("embedding_unavailable");
        } catch (RuntimeException e) {
            logger.warn("vector_stage_degraded reason=index_failure detail={}", e.getMessage(), e);
            return RetrievalStageResult.error("vector_index_failure");
        }

        List<ScoredCandidate> candidates = new ArrayList<>(hits.size());
        for (VectorHit hit : hits) {
            double similarity = similarity(hit.getDistance());
            if (similarity >= threshold) {
                candidates.add(ScoredCandidate.vector(hit.getRecordId(), hit.getMetadata(), similarity));
            }
        }
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        logger.debug("vector_stage_done pool={} hits={} kept={} took_ms={}", poolSize, hits.size(), candidates.size(), tookMs);
        return RetrievalStageResult.success(candidates, tookMs);
    }
}
