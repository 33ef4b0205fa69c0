package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ModeProfile(
    @JsonProperty("mode")               OperatingMode mode,
    @JsonProperty("baseDiscount")       double baseDiscount,
    @JsonProperty("maxDiscount")        double maxDiscount,
    @JsonProperty("occupancyThreshold") double occupancyThreshold
) {}
