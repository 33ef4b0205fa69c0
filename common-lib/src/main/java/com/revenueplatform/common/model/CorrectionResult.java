package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Target-rent correction produced by the monthly review.
 * {@code newTargetRent == previousTargetRent * appliedMultiplier}.
 */
public record CorrectionResult(
    @JsonProperty("previousTargetRent")   double previousTargetRent,
    @JsonProperty("newTargetRent")        double newTargetRent,
    @JsonProperty("appliedMultiplier")    double appliedMultiplier,
    @JsonProperty("adjustmentType")       AdjustmentType adjustmentType,
    @JsonProperty("adjustmentAmount")     double adjustmentAmount,
    @JsonProperty("adjustmentPercentage") double adjustmentPercentage
) {
    public static CorrectionResult of(double previousTargetRent, double appliedMultiplier,
                                      AdjustmentType adjustmentType) {
        double newTargetRent = previousTargetRent * appliedMultiplier;
        return new CorrectionResult(previousTargetRent, newTargetRent, appliedMultiplier,
            adjustmentType, newTargetRent - previousTargetRent, appliedMultiplier - 1);
    }
}
