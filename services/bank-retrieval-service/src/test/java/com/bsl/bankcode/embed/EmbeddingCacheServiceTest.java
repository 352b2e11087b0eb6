package com.bsl.bankcode.embed;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class EmbeddingCacheServiceTest {

    @Test
    void cacheHonorsNormalizeFlag() {
        EmbeddingProperties props = new EmbeddingProperties();
        EmbeddingProperties.Cache cache = new EmbeddingProperties.Cache();
        cache.setEnabled(true);
        cache.setNormalize(true);
        props.setCache(cache);

        EmbeddingCacheService service = new EmbeddingCacheService(props);
        service.put("ICBC 西单", List.of(0.1));
        assertTrue(service.get("icbc 西单").isPresent());

        EmbeddingProperties propsNoNorm = new EmbeddingProperties();
        EmbeddingProperties.Cache cacheNoNorm = new EmbeddingProperties.Cache();
        cacheNoNorm.setEnabled(true);
        cacheNoNorm.setNormalize(false);
        propsNoNorm.setCache(cacheNoNorm);

        EmbeddingCacheService noNormService = new EmbeddingCacheService(propsNoNorm);
        noNormService.put("ICBC 西单", List.of(0.2));
        assertFalse(noNormService.get("icbc 西单").isPresent());
    }

    @Test
    void modelChangeMissesCache() {
        EmbeddingProperties props = new EmbeddingProperties();
        EmbeddingCacheService service = new EmbeddingCacheService(props);
        service.put("工行西单", List.of(0.3));
        assertTrue(service.get("工行西单").isPresent());

        props.setModel("bge-m3");
        assertFalse(service.get("工行西单").isPresent());
    }

    @Test
    void disabledOrOverlongTextIsNotCached() {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getCache().setMaxTextLength(4);
        EmbeddingCacheService service = new EmbeddingCacheService(props);
        service.put("中国工商银行", List.of(0.4));
        assertFalse(service.get("中国工商银行").isPresent());

        props.getCache().setEnabled(false);
        service.put("工行", List.of(0.5));
        assertFalse(service.get("工行").isPresent());
    }
}
