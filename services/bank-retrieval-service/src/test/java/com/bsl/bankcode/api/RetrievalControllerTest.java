package com.bsl.bankcode.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.bsl.bankcode.config.RetrievalConfigService;
import com.bsl.bankcode.index.IndexSyncManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class RetrievalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private IndexSyncManager indexSyncManager;

    @Autowired
    private RetrievalConfigService configService;

    @BeforeEach
    void setUp() {
        configService.reset();
        indexSyncManager.rebuild(false);
    }

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void retrieveReturnsRankedBranches() throws Exception {
        mockMvc.perform(post("/retrieve")
                .header(RequestIdUtil.TRACE_HEADER, "trace-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"工商银行西单的联行号\",\"top_k\":3}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.request_id").isNotEmpty())
            .andExpect(jsonPath("$.results.length()").value(3))
            .andExpect(jsonPath("$.total_found").value(3))
            .andExpect(jsonPath("$.results[0].bank_code").value("102100099996"))
            .andExpect(jsonPath("$.results[0].retrieval_method").value("hybrid"))
            .andExpect(jsonPath("$.search_time_ms").isNumber());
    }

    @Test
    void exactNameIsReturnedFirst() throws Exception {
        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"北京银行股份有限公司西单支行\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results[0].bank_code").value("313100000013"))
            .andExpect(jsonPath("$.results[0].retrieval_method").value("exact_full_name"))
            .andExpect(jsonPath("$.results[0].final_score").value(1.0));
    }

    @Test
    void retrieveRejectsBlankQuestion() throws Exception {
        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.trace_id").isNotEmpty())
            .andExpect(jsonPath("$.request_id").isNotEmpty());
    }

    @Test
    void retrieveRejectsOutOfRangeTopK() throws Exception {
        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"工行西单\",\"top_k\":500}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void statsReportSyncedIndex() throws Exception {
        mockMvc.perform(get("/index/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.vector_db_count").value(14))
            .andExpect(jsonPath("$.source_db_count").value(14))
            .andExpect(jsonPath("$.is_synced").value(true))
            .andExpect(jsonPath("$.embedding_dimension").value(256));
    }

    @Test
    void forcedRebuildSucceeds() throws Exception {
        mockMvc.perform(post("/index/rebuild")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"force\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("index_synced"));
    }

    @Test
    void configUpdateAndReset() throws Exception {
        mockMvc.perform(post("/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vector_weight\":0.8,\"top_k\":7}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.vector_weight").value(0.8))
            .andExpect(jsonPath("$.keyword_weight").value(0.2))
            .andExpect(jsonPath("$.top_k").value(7));

        mockMvc.perform(get("/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.top_k").value(7));

        mockMvc.perform(post("/config/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.top_k").value(5))
            .andExpect(jsonPath("$.enable_hybrid").value(true));
    }

    @Test
    void invalidConfigIsRejected() throws Exception {
        mockMvc.perform(post("/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vector_weight\":0.9,\"keyword_weight\":0.9}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("invalid_config"));

        mockMvc.perform(get("/config"))
            .andExpect(jsonPath("$.vector_weight").value(0.6));
    }

    @Test
    void recordLookupByCode() throws Exception {
        mockMvc.perform(get("/records/102290000025"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bank_name").value("中国工商银行股份有限公司上海陆家嘴支行"));

        mockMvc.perform(get("/records/999999999999"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("not_found"));
    }
}
