package com.bsl.bankcode.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for a remote embedding server exposing {@code POST /v1/embed}. One
 * request carries a whole batch; the response must hold one vector per text.
 */
@Component
public class EmbeddingGateway {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingGateway.class);
    private static final String EMBED_PATH = "/v1/embed";

    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        return embedBatch(List.of(text)).get(0);
    }

    /**
     * @throws EmbeddingUnavailableException after the configured retries, or on a malformed response
     */
    public List<List<Double>> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        String url = endpoint();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EmbedBatchRequest> entity = new HttpEntity<>(
            new EmbedBatchRequest(properties.getModel(), texts, true),
            headers
        );

        int attempts = Math.max(0, properties.getRetryCount()) + 1;
        RestClientException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                EmbedBatchResponse body = restTemplate.postForObject(url, entity, EmbedBatchResponse.class);
                return vectorsOf(body, texts.size());
            } catch (RestClientException e) {
                lastFailure = e;
                logger.warn("embed_call_failed attempt={} of={} batch={} reason={}",
                    attempt, attempts, texts.size(), failureReason(e));
            }
        }
        throw new EmbeddingUnavailableException(failureReason(lastFailure), lastFailure);
    }

    static String failureReason(RestClientException e) {
        if (e instanceof HttpStatusCodeException) {
            return "embed_http_" + ((HttpStatusCodeException) e).getStatusCode().value();
        }
        if (e != null && e.getCause() instanceof SocketTimeoutException) {
            return "embed_timeout";
        }
        return "embed_unavailable";
    }

    private static List<List<Double>> vectorsOf(EmbedBatchResponse body, int expected) {
        List<List<Double>> vectors = body == null ? null : body.getVectors();
        if (vectors == null || vectors.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        if (vectors.size() != expected) {
            throw new EmbeddingUnavailableException("embed_count_mismatch");
        }
        for (List<Double> vector : vectors) {
            if (vector == null || vector.isEmpty()) {
                throw new EmbeddingUnavailableException("embed_empty_vector");
            }
        }
        return vectors;
    }

    private String endpoint() {
        String base = properties.getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        return base.endsWith("/") ? base.substring(0, base.length() - 1) + EMBED_PATH : base + EMBED_PATH;
    }

    public static class EmbedBatchRequest {
        private final String model;
        private final List<String> texts;
        private final boolean normalize;

        public EmbedBatchRequest(String model, List<String> texts, boolean normalize) {
            this.model = model;
            this.texts = texts;
            this.normalize = normalize;
        }

        public String getModel() {
            return model;
        }

        public List<String> getTexts() {
            return texts;
        }

        public boolean isNormalize() {
            return normalize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbedBatchResponse {
        private List<List<Double>> vectors;

        public List<List<Double>> getVectors() {
            return vectors;
        }

        public void setVectors(List<List<Double>> vectors) {
            this.vectors = vectors;
        }
    }
}
