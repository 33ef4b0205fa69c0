package com.revenueplatform.marketdata.config;

import com.revenueplatform.common.comparable.ComparableFilterSelector;
import com.revenueplatform.common.config.EngineSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MarketDataConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ComparableFilterSelector comparableFilterSelector() {
        return new ComparableFilterSelector(EngineSettings.defaults());
    }
}
