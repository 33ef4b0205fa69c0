package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subject property's own performance metrics. {@code myADR} and
 * {@code avgBookingLength} may be null when the data source could not derive them.
 */
public record PropertyData(
    @JsonProperty("myRevPAR")           double myRevPAR,
    @JsonProperty("myOccupancy")        double myOccupancy,
    @JsonProperty("lastYearLowestSold") double lastYearLowestSold,
    @JsonProperty("currentPrice")       double currentPrice,
    @JsonProperty("myADR")              Double myADR,
    @JsonProperty("avgBookingLength")   Double avgBookingLength
) {}
