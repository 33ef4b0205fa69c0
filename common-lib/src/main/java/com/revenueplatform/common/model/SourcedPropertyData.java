package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Property metrics as served by market-data-service; {@code live=false} marks fallback data. */
public record SourcedPropertyData(
    @JsonProperty("data") PropertyData data,
    @JsonProperty("live") boolean live
) {}
