package com.bsl.bankcode.resilience;

import org.springframework.stereotype.Component;

@Component
public class RetrievalResilienceRegistry {
    private final CircuitBreaker embedBreaker;

    public RetrievalResilienceRegistry(RetrievalResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(properties.getEmbedFailureThreshold(), properties.getEmbedOpenMs());
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }
}
