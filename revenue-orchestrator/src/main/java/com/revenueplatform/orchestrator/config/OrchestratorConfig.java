package com.revenueplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.engine.RevenueDecisionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${services.market-data.base-url}")
    private String marketDataUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    // ── engine overrides ──────────────────────────────────────────────────────
    @Value("${revenue.engine.audit-lookahead-days:14}")
    private int auditLookaheadDays;

    @Value("${revenue.engine.aps-min:0.80}")
    private double apsMin;

    @Value("${revenue.engine.aps-max:1.60}")
    private double apsMax;

    @Bean
    public WebClient marketDataClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(marketDataUrl).build();
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(notificationUrl).build();
    }

    @Bean
    public EngineSettings engineSettings() {
        EngineSettings settings = EngineSettings.defaults()
            .withAuditLookaheadDays(auditLookaheadDays)
            .withApsBounds(apsMin, apsMax);
        log.info("Engine settings loaded. auditLookaheadDays={} apsMin={} apsMax={}",
                 auditLookaheadDays, apsMin, apsMax);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RevenueDecisionEngine revenueDecisionEngine(EngineSettings engineSettings, Clock clock) {
        return new RevenueDecisionEngine(engineSettings, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
