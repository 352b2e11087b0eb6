package com.bsl.bankcode.embed;

import com.bsl.bankcode.cache.CacheKeyUtil;
import com.bsl.bankcode.cache.TtlCache;
import com.bsl.bankcode.query.QueryText;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Short-lived cache for query embeddings. Keys carry the embedding mode and
 * model, so switching backends never serves vectors from the previous one.
 * With {@code normalize} on, queries differing only in width, punctuation,
 * spacing or case share an entry.
 */
@Service
public class EmbeddingCacheService {
    private final EmbeddingProperties properties;
    private final TtlCache<List<Double>> vectors;

    public EmbeddingCacheService(EmbeddingProperties properties) {
        this.properties = properties;
        this.vectors = new TtlCache<>(settings().getMaxEntries());
    }

    public boolean isEnabled() {
        return settings().isEnabled();
    }

    public Optional<List<Double>> get(String text) {
        return keyFor(text).flatMap(vectors::get);
    }

    public void put(String text, List<Double> vector) {
        if (vector == null || vector.isEmpty()) {
            return;
        }
        keyFor(text).ifPresent(key -> vectors.put(key, List.copyOf(vector), settings().getTtlMs()));
    }

    private Optional<String> keyFor(String text) {
        if (!isEnabled() || text == null) {
            return Optional.empty();
        }
        String cacheText = settings().isNormalize()
            ? QueryText.normalize(text).toLowerCase(Locale.ROOT)
            : text.trim();
        int maxLength = settings().getMaxTextLength();
        if (cacheText.isEmpty() || (maxLength > 0 && cacheText.codePointCount(0, cacheText.length()) > maxLength)) {
            return Optional.empty();
        }
        String mode = properties.getMode() == null ? "" : properties.getMode().name();
        String model = properties.getModel() == null ? "" : properties.getModel();
        return Optional.of(mode + "|" + model + "|" + CacheKeyUtil.sha256(cacheText));
    }

    private EmbeddingProperties.Cache settings() {
        EmbeddingProperties.Cache cache = properties.getCache();
        return cache == null ? new EmbeddingProperties.Cache() : cache;
    }
}
