package com.revenueplatform.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.revenueplatform.common.engine.EngineResult;
import com.revenueplatform.common.model.ComparableSelection;
import com.revenueplatform.common.model.PropertyData;
import com.revenueplatform.common.model.ReviewType;

import java.time.Instant;

/**
 * Completed run, published by the orchestrator for report rendering and delivery.
 *
 * @param marketLive   false when the comparable selection is fallback data
 * @param propertyLive false when the property metrics are fallback data
 */
public record RevenueReportEvent(
    @JsonProperty("traceId")      String traceId,
    @JsonProperty("reviewType")   ReviewType reviewType,
    @JsonProperty("propertyId")   String propertyId,
    @JsonProperty("marketId")     String marketId,
    @JsonProperty("selection")    ComparableSelection selection,
    @JsonProperty("marketLive")   boolean marketLive,
    @JsonProperty("propertyData") PropertyData propertyData,
    @JsonProperty("propertyLive") boolean propertyLive,
    @JsonProperty("result")       EngineResult result,
    @JsonProperty("generatedAt")  Instant generatedAt
) {}
