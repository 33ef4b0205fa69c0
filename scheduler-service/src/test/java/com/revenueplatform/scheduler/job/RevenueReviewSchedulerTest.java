package com.revenueplatform.scheduler.job;

import com.revenueplatform.common.event.RevenueRunRequest;
import com.revenueplatform.common.model.ReviewType;
import com.revenueplatform.scheduler.client.OrchestratorClient;
import com.revenueplatform.scheduler.job.RevenueReviewScheduler.RunParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RevenueReviewSchedulerTest {

    private static final RunParameters PARAMS = new RunParameters(1.0, 65000, 21);

    private final List<ClientRequest> requests = new ArrayList<>();

    /** Orchestrator stub answering 502 to the first {@code failFirst} requests. */
    private OrchestratorClient client(int failFirst) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(r -> {
                requests.add(r);
                HttpStatus status = requests.size() <= failFirst ? HttpStatus.BAD_GATEWAY : HttpStatus.OK;
                return Mono.just(ClientResponse.create(status).build());
            })
            .build();
        return new OrchestratorClient(webClient);
    }

    @Test
    @DisplayName("one run posted per target, failures counted, batch continues")
    void runsEveryTarget() {
        List<ReviewTarget> targets = ReviewTarget.parseAll("a:maui:2,b:maui,c:oahu:3");
        RevenueReviewScheduler scheduler = new RevenueReviewScheduler(client(1), targets, PARAMS);

        Long accepted = scheduler.runReview(ReviewType.WEEKLY).block();

        assertEquals(2L, accepted);
        assertEquals(3, requests.size());
        assertTrue(requests.stream().allMatch(r -> r.url().getPath().equals("/api/v1/revenue/run")));
    }

    @Test
    @DisplayName("no targets → nothing posted")
    void noTargets() {
        RevenueReviewScheduler scheduler = new RevenueReviewScheduler(client(0), List.of(), PARAMS);

        assertEquals(0L, scheduler.runReview(ReviewType.MONTHLY).block());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("request carries review type, run parameters and a fresh trace id")
    void requestShape() {
        RevenueReviewScheduler scheduler = new RevenueReviewScheduler(client(0), List.of(), PARAMS);

        RevenueRunRequest r = scheduler.request(new ReviewTarget("villa", "maui", 3), ReviewType.MONTHLY);

        assertEquals("villa", r.propertyId());
        assertEquals("maui", r.marketId());
        assertEquals(3, r.filters().bedrooms());
        assertEquals(1.0, r.previousAps());
        assertEquals(65000.0, r.currentTargetRent());
        assertEquals(21, r.daysOut());
        assertEquals(ReviewType.MONTHLY, r.reviewType());
        assertNotNull(r.traceId());
    }

    @Test
    @DisplayName("trigger header matches the request trace id")
    void traceHeader() {
        RevenueReviewScheduler scheduler = new RevenueReviewScheduler(
            client(0), ReviewTarget.parseAll("villa:maui"), PARAMS);

        scheduler.runReview(ReviewType.WEEKLY).block();

        assertNotNull(requests.get(0).headers().getFirst("X-Trace-Id"));
    }
}
