package com.revenueplatform.orchestrator.service;

import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.common.event.RevenueRunRequest;
import com.revenueplatform.common.exception.MissingMarketException;
import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.ComparableTier;
import com.revenueplatform.common.model.ReviewType;
import com.revenueplatform.orchestrator.model.BatchRunSummary;
import com.revenueplatform.orchestrator.model.RevenueRunResponse;
import com.revenueplatform.orchestrator.support.CannedExchange;
import com.revenueplatform.orchestrator.support.RecordingPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.revenueplatform.orchestrator.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RevenueOrchestratorServiceTest {

    private static RevenueRunRequest request(String propertyId, String marketId, String traceId) {
        return new RevenueRunRequest(propertyId, marketId, ComparableFilters.of(3, "house", 8, List.of()),
                                     1.05, 65000.0, 21, ReviewType.WEEKLY, traceId);
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("happy path: engine result returned and report published with the same trace id")
        void happyPath() {
            CannedExchange exchange = new CannedExchange(Map.of(
                COMPARABLES_MAUI, SELECTION_JSON,
                propertyPath("p1"), PROPERTY_JSON));
            RecordingPublisher publisher = new RecordingPublisher();

            RevenueRunResponse response = service(exchange, publisher, "")
                .run(request("p1", "maui", "trace-1")).block();

            assertNotNull(response);
            assertEquals("trace-1", response.traceId());
            assertEquals(ComparableTier.STANDARD, response.tier());
            assertEquals(12, response.compCount());
            assertTrue(response.marketLive());
            assertTrue(response.propertyLive());
            assertEquals(LocalDate.of(2026, 3, 2), response.result().runDate());

            assertEquals(1, publisher.events.size());
            RevenueReportEvent event = publisher.events.get(0);
            assertEquals("trace-1", event.traceId());
            assertEquals(ReviewType.WEEKLY, event.reviewType());
            assertEquals("p1", event.propertyId());
            assertEquals(CLOCK.instant(), event.generatedAt());
            assertEquals(349.00, event.propertyData().currentPrice(), 1e-9);
        }

        @Test
        @DisplayName("comparables request carries filters and the trace header")
        void outboundRequest() {
            CannedExchange exchange = new CannedExchange(Map.of(
                COMPARABLES_MAUI, SELECTION_JSON,
                propertyPath("p1"), PROPERTY_JSON));

            service(exchange, new RecordingPublisher(), "").run(request("p1", "maui", "trace-2")).block();

            ClientRequest comparables = exchange.requests.stream()
                .filter(r -> r.url().getPath().equals(COMPARABLES_MAUI))
                .findFirst().orElseThrow();
            String query = comparables.url().getQuery();
            assertTrue(query.contains("bedrooms=3"));
            assertTrue(query.contains("propertyType=house"));
            assertTrue(query.contains("minSleeps=8"));
            assertEquals("trace-2", comparables.headers().getFirst("X-Trace-Id"));
        }

        @Test
        @DisplayName("missing marketId falls back to the configured default market")
        void defaultMarket() {
            CannedExchange exchange = new CannedExchange(Map.of(
                COMPARABLES_MAUI, SELECTION_JSON,
                propertyPath("p1"), PROPERTY_JSON));

            RevenueRunResponse response = service(exchange, new RecordingPublisher(), "maui")
                .run(request("p1", null, null)).block();

            assertEquals("maui", response.marketId());
            assertNotNull(response.traceId());
            assertFalse(response.traceId().isBlank());
        }

        @Test
        @DisplayName("no market id and no default → MissingMarketException before any fetch")
        void noMarket() {
            CannedExchange exchange = new CannedExchange(Map.of());
            RecordingPublisher publisher = new RecordingPublisher();

            assertThrows(MissingMarketException.class,
                () -> service(exchange, publisher, "").run(request("p1", " ", "t")).block());
            assertTrue(exchange.requests.isEmpty());
            assertTrue(publisher.events.isEmpty());
        }

        @Test
        @DisplayName("selection without market data → MissingMarketException, nothing published")
        void emptySelection() {
            CannedExchange exchange = new CannedExchange(Map.of(
                COMPARABLES_MAUI, EMPTY_SELECTION_JSON,
                propertyPath("p1"), PROPERTY_JSON));
            RecordingPublisher publisher = new RecordingPublisher();

            assertThrows(MissingMarketException.class,
                () -> service(exchange, publisher, "").run(request("p1", "maui", "t")).block());
            assertTrue(publisher.events.isEmpty());
        }

        @Test
        @DisplayName("market-data-service error propagates")
        void upstreamError() {
            Map<String, String> bodies = new HashMap<>();
            bodies.put(COMPARABLES_MAUI, null);
            bodies.put(propertyPath("p1"), PROPERTY_JSON);
            RecordingPublisher publisher = new RecordingPublisher();

            assertThrows(WebClientResponseException.class,
                () -> service(new CannedExchange(bodies), publisher, "").run(request("p1", "maui", "t")).block());
            assertTrue(publisher.events.isEmpty());
        }
    }

    @Nested
    @DisplayName("runAll")
    class RunAll {

        private static final String LISTING = """
            [{"id":"p1","name":"Ocean Villa","basePrice":349.0},
             {"id":"p2","name":"Garden Cottage","basePrice":210.0},
             {"id":"p3","name":"Summit House","basePrice":420.0}]
            """;

        @Test
        @DisplayName("a failing property is counted and the batch continues in order")
        void countsFailures() {
            Map<String, String> bodies = new HashMap<>();
            bodies.put(PROPERTIES, LISTING);
            bodies.put(COMPARABLES_MAUI, SELECTION_JSON);
            bodies.put(propertyPath("p1"), PROPERTY_JSON);
            bodies.put(propertyPath("p2"), null);
            bodies.put(propertyPath("p3"), PROPERTY_JSON);
            RecordingPublisher publisher = new RecordingPublisher();

            BatchRunSummary summary = service(new CannedExchange(bodies), publisher, "maui")
                .runAll(null, ReviewType.MONTHLY).block();

            assertEquals(3, summary.total());
            assertEquals(2, summary.succeeded());
            assertEquals(1, summary.failed());
            assertEquals(List.of("p2"), summary.failedPropertyIds());
            assertEquals(List.of("p1", "p3"),
                publisher.events.stream().map(RevenueReportEvent::propertyId).toList());
            assertTrue(publisher.events.stream().allMatch(e -> e.reviewType() == ReviewType.MONTHLY));
        }

        @Test
        @DisplayName("no listed properties → empty summary")
        void emptyListing() {
            CannedExchange exchange = new CannedExchange(Map.of(PROPERTIES, "[]"));

            BatchRunSummary summary = service(exchange, new RecordingPublisher(), "maui")
                .runAll(null, null).block();

            assertEquals(0, summary.total());
            assertEquals(0, summary.failed());
        }

        @Test
        @DisplayName("without any market id every property fails")
        void noMarketFailsAll() {
            CannedExchange exchange = new CannedExchange(Map.of(PROPERTIES, LISTING));

            BatchRunSummary summary = service(exchange, new RecordingPublisher(), "")
                .runAll(null, null).block();

            assertEquals(3, summary.failed());
            assertEquals(List.of("p1", "p2", "p3"), summary.failedPropertyIds());
        }
    }
}
