package com.revenueplatform.scheduler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class SchedulerConfig {

    @Value("${services.orchestrator.base-url}")
    private String orchestratorUrl;

    @Bean
    public WebClient orchestratorWebClient(WebClient.Builder builder) {
        return builder.baseUrl(orchestratorUrl).build();
    }
}
