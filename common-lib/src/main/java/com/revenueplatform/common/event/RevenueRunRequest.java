package com.revenueplatform.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.ReviewType;

/**
 * Request to run the engine for one property. Optional fields fall back to the
 * orchestrator's defaults: {@code previousAps} 1.0, {@code currentTargetRent} 0
 * (bootstrap), {@code daysOut} 21, {@code reviewType} ON_DEMAND.
 */
public record RevenueRunRequest(
    @JsonProperty("propertyId")        String propertyId,
    @JsonProperty("marketId")          String marketId,
    @JsonProperty("filters")           ComparableFilters filters,
    @JsonProperty("previousAps")       Double previousAps,
    @JsonProperty("currentTargetRent") Double currentTargetRent,
    @JsonProperty("daysOut")           Integer daysOut,
    @JsonProperty("reviewType")        ReviewType reviewType,
    @JsonProperty("traceId")           String traceId
) {}
