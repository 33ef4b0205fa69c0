package com.revenueplatform.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.revenueplatform.common.engine.EngineResult;
import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.common.model.ComparableTier;
import com.revenueplatform.common.model.ReviewType;

public record RevenueRunResponse(
    @JsonProperty("traceId")      String traceId,
    @JsonProperty("propertyId")   String propertyId,
    @JsonProperty("marketId")     String marketId,
    @JsonProperty("reviewType")   ReviewType reviewType,
    @JsonProperty("tier")         ComparableTier tier,
    @JsonProperty("compCount")    int compCount,
    @JsonProperty("marketLive")   boolean marketLive,
    @JsonProperty("propertyLive") boolean propertyLive,
    @JsonProperty("result")       EngineResult result
) {
    public static RevenueRunResponse from(RevenueReportEvent event) {
        return new RevenueRunResponse(
            event.traceId(),
            event.propertyId(),
            event.marketId(),
            event.reviewType(),
            event.selection().tier(),
            event.selection().dataPoints(),
            event.marketLive(),
            event.propertyLive(),
            event.result());
    }
}
