package com.bsl.bankcode.config;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the live {@link RetrievalConfig}. The value is process-local and seeded
 * from {@code retrieval.defaults}; it is not persisted across restarts.
 */
@Service
public class RetrievalConfigService {
    private static final Logger logger = LoggerFactory.getLogger(RetrievalConfigService.class);

    static final String SIMILARITY_THRESHOLD = "similarity_threshold";
    static final String TOP_K = "top_k";
    static final String VECTOR_WEIGHT = "vector_weight";
    static final String KEYWORD_WEIGHT = "keyword_weight";
    static final String ENABLE_HYBRID = "enable_hybrid";
    private static final Set<String> KNOWN_KEYS = Set.of(
        SIMILARITY_THRESHOLD, TOP_K, VECTOR_WEIGHT, KEYWORD_WEIGHT, ENABLE_HYBRID
    );

    private final RetrievalProperties properties;
    private final AtomicReference<RetrievalConfig> current;

    public RetrievalConfigService(RetrievalProperties properties) {
        this.properties = properties;
        RetrievalConfig defaults = RetrievalConfig.from(properties.getDefaults());
        validate(defaults);
        this.current = new AtomicReference<>(defaults);
    }

    public RetrievalConfig current() {
        return current.get();
    }

    /**
     * Applies a partial update. Either every change is applied or none is.
     *
     * @throws InvalidConfigException on unknown keys, wrong types or out-of-range values
     */
    public synchronized RetrievalConfig update(Map<String, ?> changes) {
        if (changes == null || changes.isEmpty()) {
            return current.get();
        }
        for (String key : changes.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new InvalidConfigException("unknown config key: " + key);
            }
        }
        RetrievalConfig base = current.get();
        double threshold = changes.containsKey(SIMILARITY_THRESHOLD)
            ? toDouble(SIMILARITY_THRESHOLD, changes.get(SIMILARITY_THRESHOLD))
            : base.getSimilarityThreshold();
        int topK = changes.containsKey(TOP_K) ? toInt(TOP_K, changes.get(TOP_K)) : base.getTopK();
        boolean hybrid = changes.containsKey(ENABLE_HYBRID)
            ? toBoolean(ENABLE_HYBRID, changes.get(ENABLE_HYBRID))
            : base.isEnableHybrid();

        boolean hasVector = changes.containsKey(VECTOR_WEIGHT);
        boolean hasKeyword = changes.containsKey(KEYWORD_WEIGHT);
        double vectorWeight = base.getVectorWeight();
        double keywordWeight = base.getKeywordWeight();
        if (hasVector && hasKeyword) {
            vectorWeight = toDouble(VECTOR_WEIGHT, changes.get(VECTOR_WEIGHT));
            keywordWeight = toDouble(KEYWORD_WEIGHT, changes.get(KEYWORD_WEIGHT));
        } else if (hasVector) {
            vectorWeight = toDouble(VECTOR_WEIGHT, changes.get(VECTOR_WEIGHT));
            keywordWeight = complement(vectorWeight);
        } else if (hasKeyword) {
            keywordWeight = toDouble(KEYWORD_WEIGHT, changes.get(KEYWORD_WEIGHT));
            vectorWeight = complement(keywordWeight);
        }

        RetrievalConfig next = new RetrievalConfig(threshold, topK, vectorWeight, keywordWeight, hybrid);
        validate(next);
        current.set(next);
        logger.info("retrieval_config_updated keys={} config={}", changes.keySet(), next);
        return next;
    }

    public synchronized RetrievalConfig reset() {
        RetrievalConfig defaults = RetrievalConfig.from(properties.getDefaults());
        current.set(defaults);
        logger.info("retrieval_config_reset config={}", defaults);
        return defaults;
    }

    static void validate(RetrievalConfig config) {
        requireUnit(SIMILARITY_THRESHOLD, config.getSimilarityThreshold());
        requireUnit(VECTOR_WEIGHT, config.getVectorWeight());
        requireUnit(KEYWORD_WEIGHT, config.getKeywordWeight());
        if (config.getTopK() < RetrievalConfig.MIN_TOP_K || config.getTopK() > RetrievalConfig.MAX_TOP_K) {
            throw new InvalidConfigException(
                TOP_K + " must be between " + RetrievalConfig.MIN_TOP_K + " and " + RetrievalConfig.MAX_TOP_K
            );
        }
        double sum = config.getVectorWeight() + config.getKeywordWeight();
        if (Math.abs(sum - 1.0) > RetrievalConfig.WEIGHT_SUM_TOLERANCE) {
            throw new InvalidConfigException(
                String.format(Locale.ROOT, "vector_weight + keyword_weight must equal 1.0, got %.4f", sum)
            );
        }
    }

    private static double complement(double weight) {
        return Math.round((1.0 - weight) * 1_000_000d) / 1_000_000d;
    }

    private static void requireUnit(String key, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigException(key + " must be between 0 and 1");
        }
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigException(key + " must be a number");
            }
        }
        throw new InvalidConfigException(key + " must be a number");
    }

    private static int toInt(String key, Object value) {
        double number = toDouble(key, value);
        if (number != Math.rint(number) || Double.isInfinite(number)) {
            throw new InvalidConfigException(key + " must be an integer");
        }
        return (int) number;
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim().toLowerCase(Locale.ROOT);
            if ("true".equals(text) || "false".equals(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw new InvalidConfigException(key + " must be a boolean");
    }
}
