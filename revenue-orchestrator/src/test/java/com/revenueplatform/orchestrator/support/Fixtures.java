package com.revenueplatform.orchestrator.support;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.engine.RevenueDecisionEngine;
import com.revenueplatform.orchestrator.adapter.MarketDataAdapter;
import com.revenueplatform.orchestrator.logger.RevenueFlowLogger;
import com.revenueplatform.orchestrator.service.RevenueOrchestratorService;
import com.revenueplatform.orchestrator.service.RevenueOrchestratorService.RunDefaults;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public final class Fixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);

    public static final String COMPARABLES_MAUI = "/api/v1/market-data/comparables/maui";
    public static final String PROPERTIES       = "/api/v1/property-data";

    public static final String SELECTION_JSON = """
        {"selection":{"tier":"STANDARD",
                      "appliedFilters":{"bedrooms":3,"minSleeps":8},
                      "marketData":{"marketRevPAR":189.50,"marketOccupancy":0.72,
                                    "market20thPctlADR":155.00,"peakFutureADR":485.00,
                                    "avgFutureMarketADR":310.00,"totalMarketAnnualRevPAR":69178,
                                    "avgADR":263.19,"avgBookingLength":4.8},
                      "dataPoints":12},
         "live":true}
        """;

    public static final String EMPTY_SELECTION_JSON = """
        {"selection":{"tier":"WHOLE_MARKET","dataPoints":0},"live":false}
        """;

    public static final String PROPERTY_JSON = """
        {"data":{"myRevPAR":215.75,"myOccupancy":0.58,"lastYearLowestSold":139.00,
                 "currentPrice":349.00,"myADR":371.98,"avgBookingLength":2.4},
         "live":true}
        """;

    private Fixtures() {}

    public static String propertyPath(String propertyId) {
        return PROPERTIES + "/" + propertyId;
    }

    public static RevenueOrchestratorService service(CannedExchange exchange, RecordingPublisher publisher,
                                                     String defaultMarketId) {
        return new RevenueOrchestratorService(
            new MarketDataAdapter(exchange.webClient()),
            new RevenueDecisionEngine(EngineSettings.defaults(), CLOCK),
            publisher,
            new RevenueFlowLogger(),
            CLOCK,
            new RunDefaults(defaultMarketId, 1.0, 0.0, 21));
    }
}
