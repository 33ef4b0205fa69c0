package com.revenueplatform.common.formula;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outputs of {@link RevenueFormulas#compute}. */
public record CoreMetrics(
    @JsonProperty("performanceIndex") double performanceIndex,
    @JsonProperty("newAps")           double newAps,
    @JsonProperty("annualTarget")     double annualTarget,
    @JsonProperty("minPrice")         double minPrice,
    @JsonProperty("maxPrice")         double maxPrice,
    @JsonProperty("dynamicCentroid")  double dynamicCentroid,
    @JsonProperty("basePrice")        double basePrice
) {}
