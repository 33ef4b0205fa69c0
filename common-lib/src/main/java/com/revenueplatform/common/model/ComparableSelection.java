package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of the tiered comparable fallback: which tier was accepted, the filters
 * actually applied ({@code null} for the whole market) and the resulting sample.
 * Reported in the report header for transparency.
 */
public record ComparableSelection(
    @JsonProperty("tier")           ComparableTier tier,
    @JsonProperty("appliedFilters") ComparableFilters appliedFilters,
    @JsonProperty("marketData")     MarketData marketData,
    @JsonProperty("dataPoints")     int dataPoints
) {}
