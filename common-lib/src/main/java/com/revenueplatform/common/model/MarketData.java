package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated comparable-set metrics for one engine run.
 *
 * <p>{@code avgBookingLength} and {@code forwardOccupancy} are optional. When
 * {@code forwardOccupancy} is absent the engine treats {@code marketOccupancy}
 * as the forward pace.
 */
public record MarketData(
    @JsonProperty("marketRevPAR")            double marketRevPAR,
    @JsonProperty("marketOccupancy")         double marketOccupancy,
    @JsonProperty("market20thPctlADR")       double market20thPctlADR,
    @JsonProperty("peakFutureADR")           double peakFutureADR,
    @JsonProperty("avgFutureMarketADR")      double avgFutureMarketADR,
    @JsonProperty("totalMarketAnnualRevPAR") double totalMarketAnnualRevPAR,
    @JsonProperty("avgADR")                  double avgADR,
    @JsonProperty("avgBookingLength")        Double avgBookingLength,
    @JsonProperty("forwardOccupancy")        Double forwardOccupancy
) {
    public double effectiveForwardOccupancy() {
        return forwardOccupancy != null ? forwardOccupancy : marketOccupancy;
    }
}
