package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One fetch of aggregated market data together with the number of comps behind it. */
public record MarketSample(
    @JsonProperty("marketData") MarketData marketData,
    @JsonProperty("dataPoints") int dataPoints
) {}
