package com.revenueplatform.scheduler.client;

import com.revenueplatform.common.event.RevenueRunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Posts {@link RevenueRunRequest}s to revenue-orchestrator.
 *
 * <p>Errors are absorbed into {@code false} so a failing property never stops the
 * rest of a scheduled review.
 */
@Component
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private final WebClient orchestratorWebClient;

    public OrchestratorClient(WebClient orchestratorWebClient) {
        this.orchestratorWebClient = orchestratorWebClient;
    }

    /** @return {@code true} when the orchestrator accepted the run */
    public Mono<Boolean> triggerRun(RevenueRunRequest request) {
        return orchestratorWebClient.post()
            .uri("/api/v1/revenue/run")
            .header("X-Trace-Id", request.traceId())
            .bodyValue(request)
            .retrieve()
            .toBodilessEntity()
            .map(r -> {
                log.info("Revenue run triggered. propertyId={} reviewType={} traceId={} status={}",
                         request.propertyId(), request.reviewType(), request.traceId(), r.getStatusCode());
                return true;
            })
            .onErrorResume(e -> {
                log.error("Revenue run trigger failed. propertyId={} reviewType={} traceId={} reason={}",
                          request.propertyId(), request.reviewType(), request.traceId(), e.getMessage());
                return Mono.just(false);
            });
    }
}
