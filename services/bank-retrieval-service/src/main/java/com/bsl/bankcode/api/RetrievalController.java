package com.bsl.bankcode.api;

import com.bsl.bankcode.api.dto.ErrorResponse;
import com.bsl.bankcode.api.dto.RebuildRequest;
import com.bsl.bankcode.api.dto.RebuildResponse;
import com.bsl.bankcode.api.dto.RecordResponse;
import com.bsl.bankcode.api.dto.RetrieveRequest;
import com.bsl.bankcode.api.dto.RetrieveResponse;
import com.bsl.bankcode.config.InvalidConfigException;
import com.bsl.bankcode.config.RetrievalConfig;
import com.bsl.bankcode.config.RetrievalConfigService;
import com.bsl.bankcode.index.IndexStats;
import com.bsl.bankcode.index.IndexSyncManager;
import com.bsl.bankcode.service.BankRetrievalService;
import com.bsl.bankcode.service.InvalidRetrievalRequestException;
import com.bsl.bankcode.service.RetrievalOutcome;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RetrievalController {
    private static final Logger logger = LoggerFactory.getLogger(RetrievalController.class);

    private final BankRetrievalService retrievalService;
    private final IndexSyncManager indexSyncManager;
    private final RetrievalConfigService configService;

    public RetrievalController(
        BankRetrievalService retrievalService,
        IndexSyncManager indexSyncManager,
        RetrievalConfigService configService
    ) {
        this.retrievalService = retrievalService;
        this.indexSyncManager = indexSyncManager;
        this.configService = configService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/retrieve")
    public ResponseEntity<?> retrieve(
        @RequestBody(required = false) RetrieveRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);

        if (request == null || isBlank(request.getQuestion())) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "question is required", traceId, requestId)
            );
        }

        RetrievalOutcome outcome;
        try {
            outcome = retrievalService.retrieve(request.getQuestion(), request.getTopK(), request.getSimilarityThreshold());
        } catch (InvalidRetrievalRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        }

        RetrieveResponse response = new RetrieveResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setQuestion(request.getQuestion());
        response.setResults(outcome.getResults());
        response.setTotalFound(outcome.getTotalFound());
        response.setSearchTimeMs(outcome.getSearchTimeMs());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/index/stats")
    public IndexStats stats() {
        return indexSyncManager.stats();
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<RebuildResponse> rebuild(@RequestBody(required = false) RebuildRequest request) {
        boolean force = request != null && Boolean.TRUE.equals(request.getForce());
        boolean async = request != null && Boolean.TRUE.equals(request.getAsync());
        if (async) {
            indexSyncManager.rebuildAsync(force).whenComplete((built, error) -> {
                if (error != null) {
                    logger.error("index_async_rebuild_failed reason={}", error.getMessage(), error);
                }
            });
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RebuildResponse(true, "rebuild_started"));
        }
        boolean built = indexSyncManager.rebuild(force);
        String message = built ? "index_synced" : "source_empty";
        return ResponseEntity.ok(new RebuildResponse(built, message));
    }

    @GetMapping("/config")
    public RetrievalConfig config() {
        return configService.current();
    }

    @PostMapping("/config")
    public ResponseEntity<?> updateConfig(
        @RequestBody(required = false) Map<String, Object> changes,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestHeader
    ) {
        try {
            return ResponseEntity.ok(configService.update(changes));
        } catch (InvalidConfigException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse(
                "invalid_config",
                e.getMessage(),
                RequestIdUtil.resolveOrGenerate(traceHeader),
                RequestIdUtil.resolveOrGenerate(requestHeader)
            ));
        }
    }

    @PostMapping("/config/reset")
    public RetrievalConfig resetConfig() {
        return configService.reset();
    }

    @GetMapping("/records/{bankCode}")
    public ResponseEntity<?> record(
        @PathVariable("bankCode") String bankCode,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestHeader
    ) {
        return retrievalService.findByCode(bankCode)
            .<ResponseEntity<?>>map(record -> ResponseEntity.ok(RecordResponse.from(record)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(
                "not_found",
                "no record for bank code " + bankCode,
                RequestIdUtil.resolveOrGenerate(traceHeader),
                RequestIdUtil.resolveOrGenerate(requestHeader)
            )));
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
