package com.revenueplatform.orchestrator.controller;

import com.revenueplatform.orchestrator.support.CannedExchange;
import com.revenueplatform.orchestrator.support.RecordingPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.HashMap;
import java.util.Map;

import static com.revenueplatform.orchestrator.support.Fixtures.*;

class RevenueControllerTest {

    private static WebTestClient client(Map<String, String> bodies, String defaultMarketId) {
        RevenueController controller = new RevenueController(
            service(new CannedExchange(bodies), new RecordingPublisher(), defaultMarketId));
        return WebTestClient.bindToController(controller).build();
    }

    @Test
    @DisplayName("POST /run answers 200 with the engine result")
    void runOk() {
        client(Map.of(COMPARABLES_MAUI, SELECTION_JSON, propertyPath("p1"), PROPERTY_JSON), "")
            .post().uri("/api/v1/revenue/run")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"propertyId\":\"p1\",\"marketId\":\"maui\",\"reviewType\":\"WEEKLY\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.propertyId").isEqualTo("p1")
            .jsonPath("$.tier").isEqualTo("STANDARD")
            .jsonPath("$.result.weeklyReview").exists();
    }

    @Test
    @DisplayName("POST /run without a market answers 400")
    void missingMarket() {
        client(Map.of(), "")
            .post().uri("/api/v1/revenue/run")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"propertyId\":\"p1\"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.component").isEqualTo("Orchestrator");
    }

    @Test
    @DisplayName("POST /run-all answers the batch summary")
    void runAll() {
        Map<String, String> bodies = new HashMap<>();
        bodies.put(PROPERTIES, "[{\"id\":\"p1\",\"name\":\"Ocean Villa\",\"basePrice\":349.0}]");
        bodies.put(COMPARABLES_MAUI, SELECTION_JSON);
        bodies.put(propertyPath("p1"), PROPERTY_JSON);

        client(bodies, "maui")
            .post().uri("/api/v1/revenue/run-all?reviewType=MONTHLY")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.total").isEqualTo(1)
            .jsonPath("$.succeeded").isEqualTo(1);
    }

    @Test
    @DisplayName("GET /health answers OK")
    void health() {
        client(Map.of(), "")
            .get().uri("/api/v1/revenue/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
