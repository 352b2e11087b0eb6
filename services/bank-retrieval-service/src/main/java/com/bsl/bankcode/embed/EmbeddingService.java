package com.bsl.bankcode.embed;

import com.bsl.bankcode.resilience.CircuitBreaker;
import com.bsl.bankcode.resilience.RetrievalResilienceRegistry;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Routes embedding calls to the local toy embedder or the remote gateway.
 * Query embeddings go through the cache; remote calls go through the embed breaker.
 */
@Component
public class EmbeddingService implements EmbeddingProvider {
    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final RetrievalResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        RetrievalResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text) {
        if (cacheService.isEnabled()) {
            return cacheService.get(text).orElseGet(() -> fetchAndCache(text));
        }
        return fetch(text);
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        if (properties.getMode() == EmbeddingMode.HTTP) {
            return guarded(() -> embeddingGateway.embedBatch(texts));
        }
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(toyEmbedder.embed(text));
        }
        return vectors;
    }

    private List<Double> fetchAndCache(String text) {
        List<Double> vector = fetch(text);
        cacheService.put(text, vector);
        return vector;
    }

    private List<Double> fetch(String text) {
        if (properties.getMode() == EmbeddingMode.HTTP) {
            return guarded(() -> embeddingGateway.embed(text));
        }
        return toyEmbedder.embed(text);
    }

    private <T> T guarded(RemoteCall<T> call) {
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            T result = call.execute();
            breaker.recordSuccess();
            return result;
        } catch (EmbeddingUnavailableException ex) {
            breaker.recordFailure();
            throw ex;
        }
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T execute();
    }
}
