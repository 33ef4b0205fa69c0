package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Active listing as returned by the property directory. */
public record PropertySummary(
    @JsonProperty("id")        String id,
    @JsonProperty("name")      String name,
    @JsonProperty("basePrice") double basePrice
) {}
