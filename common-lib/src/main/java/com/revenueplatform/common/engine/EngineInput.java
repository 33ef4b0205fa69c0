package com.revenueplatform.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.revenueplatform.common.model.MarketData;
import com.revenueplatform.common.model.PropertyData;

/**
 * Everything one engine run needs.
 *
 * @param previousAps       the score carried over from the last run (1.0 for a first run)
 * @param currentTargetRent annual target; 0 or negative bootstraps from the market
 * @param daysOut           reference lead time for the run-level promotion rules
 */
public record EngineInput(
    @JsonProperty("propertyData")      PropertyData propertyData,
    @JsonProperty("marketData")        MarketData marketData,
    @JsonProperty("previousAps")       double previousAps,
    @JsonProperty("currentTargetRent") double currentTargetRent,
    @JsonProperty("daysOut")           int daysOut
) {}
