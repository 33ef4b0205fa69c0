package com.revenueplatform.common.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.revenueplatform.common.model.CorrectionResult;
import com.revenueplatform.common.model.Diagnosis;
import com.revenueplatform.common.model.PerformanceMultipliers;

public record MonthlyReviewResult(
    @JsonProperty("multipliers") PerformanceMultipliers multipliers,
    @JsonProperty("diagnosis")   Diagnosis diagnosis,
    @JsonProperty("correction")  CorrectionResult correction,
    @JsonProperty("previousAps") double previousAps,
    @JsonProperty("newAps")      double newAps
) {}
