package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Property-to-market ratios for occupancy, RevPAR and ADR. */
public record PerformanceMultipliers(
    @JsonProperty("occupancy") double occupancy,
    @JsonProperty("revPAR")    double revPAR,
    @JsonProperty("adr")       double adr
) {}
