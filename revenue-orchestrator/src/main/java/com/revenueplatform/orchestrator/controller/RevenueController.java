package com.revenueplatform.orchestrator.controller;

import com.revenueplatform.common.event.RevenueRunRequest;
import com.revenueplatform.common.exception.MissingMarketException;
import com.revenueplatform.common.exception.RevenueEngineException;
import com.revenueplatform.common.model.ReviewType;
import com.revenueplatform.orchestrator.model.BatchRunSummary;
import com.revenueplatform.orchestrator.model.RevenueRunResponse;
import com.revenueplatform.orchestrator.service.RevenueOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/revenue")
public class RevenueController {

    private final RevenueOrchestratorService orchestratorService;

    public RevenueController(RevenueOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<Object>> run(@RequestBody RevenueRunRequest request,
                                            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        RevenueRunRequest traced = request.traceId() == null && traceId != null
            ? new RevenueRunRequest(request.propertyId(), request.marketId(), request.filters(),
                                    request.previousAps(), request.currentTargetRent(), request.daysOut(),
                                    request.reviewType(), traceId)
            : request;
        return orchestratorService.run(traced)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(MissingMarketException.class, e ->
                Mono.just(ResponseEntity.badRequest().body(error(e))))
            .onErrorResume(RevenueEngineException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error(e))));
    }

    @PostMapping("/run-all")
    public Mono<ResponseEntity<BatchRunSummary>> runAll(
            @RequestParam(value = "marketId", required = false) String marketId,
            @RequestParam(value = "reviewType", required = false) ReviewType reviewType) {
        return orchestratorService.runAll(marketId, reviewType).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static Map<String, String> error(RevenueEngineException e) {
        return Map.of("component", e.getComponent(), "error", e.getMessage());
    }
}
