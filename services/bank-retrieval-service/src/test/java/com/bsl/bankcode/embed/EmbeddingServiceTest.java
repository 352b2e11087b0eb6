package com.bsl.bankcode.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.bsl.bankcode.resilience.RetrievalResilienceProperties;
import com.bsl.bankcode.resilience.RetrievalResilienceRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private EmbeddingGateway gateway;

    private EmbeddingProperties properties;
    private RetrievalResilienceRegistry resilienceRegistry;

    @BeforeEach
    void setUp() {
        properties = new EmbeddingProperties();
        RetrievalResilienceProperties resilience = new RetrievalResilienceProperties();
        resilience.setEmbedFailureThreshold(2);
        resilience.setEmbedOpenMs(60000);
        resilienceRegistry = new RetrievalResilienceRegistry(resilience);
    }

    private EmbeddingService service() {
        return new EmbeddingService(
            properties,
            gateway,
            new ToyEmbedder(32),
            new EmbeddingCacheService(properties),
            resilienceRegistry
        );
    }

    @Test
    void toyModeNeverCallsGateway() {
        EmbeddingService service = service();

        assertThat(service.embed("工行西单")).hasSize(32);
        assertThat(service.embedBatch(List.of("a", "b"))).hasSize(2);
        verifyNoInteractions(gateway);
    }

    @Test
    void httpModeCachesQueryEmbeddings() {
        properties.setMode(EmbeddingMode.HTTP);
        when(gateway.embed("工行西单")).thenReturn(List.of(0.6, 0.8));
        EmbeddingService service = service();

        assertThat(service.embed("工行西单")).containsExactly(0.6, 0.8);
        assertThat(service.embed("工行西单")).containsExactly(0.6, 0.8);

        verify(gateway, times(1)).embed("工行西单");
    }

    @Test
    void breakerOpensAfterRepeatedFailures() {
        properties.setMode(EmbeddingMode.HTTP);
        properties.getCache().setEnabled(false);
        when(gateway.embed(anyString())).thenThrow(new EmbeddingUnavailableException("embed_timeout"));
        EmbeddingService service = service();

        assertThatThrownBy(() -> service.embed("q1")).hasMessage("embed_timeout");
        assertThatThrownBy(() -> service.embed("q2")).hasMessage("embed_timeout");
        assertThatThrownBy(() -> service.embed("q3")).hasMessage("embed_circuit_open");
        assertThatThrownBy(() -> service.embedBatch(List.of("doc"))).hasMessage("embed_circuit_open");

        verify(gateway, times(2)).embed(anyString());
        verify(gateway, times(0)).embedBatch(anyList());
    }
}
