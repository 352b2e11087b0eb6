package com.bsl.bankcode.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetrievalConfigServiceTest {
    private RetrievalConfigService service;

    @BeforeEach
    void setUp() {
        service = new RetrievalConfigService(new RetrievalProperties());
    }

    @Test
    void startsFromDefaults() {
        RetrievalConfig config = service.current();

        assertThat(config.getSimilarityThreshold()).isEqualTo(0.1);
        assertThat(config.getTopK()).isEqualTo(5);
        assertThat(config.getVectorWeight()).isEqualTo(0.6);
        assertThat(config.getKeywordWeight()).isEqualTo(0.4);
        assertThat(config.isEnableHybrid()).isTrue();
    }

    @Test
    void partialUpdateKeepsOtherFields() {
        RetrievalConfig updated = service.update(Map.of("top_k", 10, "similarity_threshold", "0.3"));

        assertThat(updated.getTopK()).isEqualTo(10);
        assertThat(updated.getSimilarityThreshold()).isEqualTo(0.3);
        assertThat(updated.getVectorWeight()).isEqualTo(0.6);
        assertThat(service.current()).isEqualTo(updated);
    }

    @Test
    void singleWeightGetsComplement() {
        RetrievalConfig updated = service.update(Map.of("vector_weight", 0.7));

        assertThat(updated.getVectorWeight()).isEqualTo(0.7);
        assertThat(updated.getKeywordWeight()).isEqualTo(0.3);

        updated = service.update(Map.of("keyword_weight", 1));
        assertThat(updated.getVectorWeight()).isEqualTo(0.0);
        assertThat(updated.getKeywordWeight()).isEqualTo(1.0);
    }

    @Test
    void invalidUpdatesLeaveConfigUntouched() {
        RetrievalConfig before = service.current();

        assertThatThrownBy(() -> service.update(Map.of("vector_weight", 0.7, "keyword_weight", 0.7)))
            .isInstanceOf(InvalidConfigException.class)
            .hasMessageContaining("must equal 1.0");
        assertThatThrownBy(() -> service.update(Map.of("top_k", 0))).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> service.update(Map.of("top_k", 51))).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> service.update(Map.of("top_k", 2.5))).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> service.update(Map.of("similarity_threshold", 1.5))).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> service.update(Map.of("enable_hybrid", "yes"))).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> service.update(Map.of("rerank", true)))
            .isInstanceOf(InvalidConfigException.class)
            .hasMessageContaining("rerank");

        Map<String, Object> mixed = new HashMap<>();
        mixed.put("top_k", 8);
        mixed.put("similarity_threshold", -0.1);
        assertThatThrownBy(() -> service.update(mixed)).isInstanceOf(InvalidConfigException.class);

        assertThat(service.current()).isEqualTo(before);
    }

    @Test
    void weightsWithinToleranceAreAccepted() {
        RetrievalConfig updated = service.update(Map.of("vector_weight", 0.505, "keyword_weight", 0.5));

        assertThat(updated.getVectorWeight()).isEqualTo(0.505);
    }

    @Test
    void resetRestoresDefaults() {
        service.update(Map.of("enable_hybrid", false, "top_k", 20));

        RetrievalConfig reset = service.reset();

        assertThat(reset.isEnableHybrid()).isTrue();
        assertThat(reset.getTopK()).isEqualTo(5);
        assertThat(service.current()).isEqualTo(reset);
    }
}
