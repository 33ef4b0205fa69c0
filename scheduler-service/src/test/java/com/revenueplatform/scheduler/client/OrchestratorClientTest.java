package com.revenueplatform.scheduler.client;

import com.revenueplatform.common.event.RevenueRunRequest;
import com.revenueplatform.common.model.ReviewType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorClientTest {

    private static final RevenueRunRequest REQUEST =
        new RevenueRunRequest("villa", "maui", null, 1.0, 65000.0, 21, ReviewType.WEEKLY, "trace-3");

    private static OrchestratorClient client(WebClient webClient) {
        return new OrchestratorClient(webClient);
    }

    @Test
    @DisplayName("2xx → true")
    void accepted() {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(r -> Mono.just(ClientResponse.create(HttpStatus.OK).build()))
            .build();

        assertTrue(client(webClient).triggerRun(REQUEST).block());
    }

    @Test
    @DisplayName("error status → false, never an error signal")
    void rejected() {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(r -> Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST).build()))
            .build();

        assertFalse(client(webClient).triggerRun(REQUEST).block());
    }

    @Test
    @DisplayName("connection failure → false")
    void unreachable() {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(r -> Mono.error(new IllegalStateException("connection refused")))
            .build();

        assertFalse(client(webClient).triggerRun(REQUEST).block());
    }
}
