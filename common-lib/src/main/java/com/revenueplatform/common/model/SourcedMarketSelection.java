package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Comparable selection as served by market-data-service; {@code live=false} marks fallback data. */
public record SourcedMarketSelection(
    @JsonProperty("selection") ComparableSelection selection,
    @JsonProperty("live")      boolean live
) {}
