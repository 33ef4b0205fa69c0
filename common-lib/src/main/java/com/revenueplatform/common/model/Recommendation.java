package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One pricing or promotion action for a stay date.
 *
 * <p>{@code phase} and {@code operatingMode} are null for promotion-scanner findings
 * that sit outside the bell curve.
 */
public record Recommendation(
    @JsonProperty("date")           LocalDate date,
    @JsonProperty("type")           RecommendationType type,
    @JsonProperty("value")          String value,
    @JsonProperty("currentPrice")   double currentPrice,
    @JsonProperty("suggestedPrice") double suggestedPrice,
    @JsonProperty("rationale")      String rationale,
    @JsonProperty("phase")          BookingPhase phase,
    @JsonProperty("marketState")    MarketState marketState,
    @JsonProperty("operatingMode")  OperatingMode operatingMode
) {}
