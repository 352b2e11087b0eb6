package com.bsl.bankcode.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {
    private MockRestServiceServer server;
    private EmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setMode(EmbeddingMode.HTTP);
        properties.setBaseUrl("http://embed.local/");
        properties.setModel("bge-m3");
        properties.setRetryCount(1);
        gateway = new EmbeddingGateway(restTemplate, properties);
    }

    @Test
    void batchReturnsOneVectorPerText() {
        server.expect(requestTo("http://embed.local/v1/embed"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.model").value("bge-m3"))
            .andExpect(jsonPath("$.texts.length()").value(2))
            .andRespond(withSuccess("{\"vectors\":[[0.1,0.2],[0.3,0.4]]}", MediaType.APPLICATION_JSON));

        List<List<Double>> vectors = gateway.embedBatch(List.of("工行西单", "建行陆家嘴"));

        assertThat(vectors).containsExactly(List.of(0.1, 0.2), List.of(0.3, 0.4));
        server.verify();
    }

    @Test
    void vectorCountMismatchIsRejected() {
        server.expect(requestTo("http://embed.local/v1/embed"))
            .andRespond(withSuccess("{\"vectors\":[[0.1,0.2]]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embedBatch(List.of("a", "b")))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_count_mismatch");
    }

    @Test
    void serverErrorsAreRetriedThenReported() {
        server.expect(times(2), requestTo("http://embed.local/v1/embed"))
            .andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> gateway.embed("工行西单"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_503");
        server.verify();
    }

    @Test
    void unreadableResponseBodyIsReportedAsUnavailable() {
        server.expect(times(2), requestTo("http://embed.local/v1/embed"))
            .andRespond(withSuccess("<html>gateway</html>", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("工行西单"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_unavailable");
        server.verify();
    }
}
