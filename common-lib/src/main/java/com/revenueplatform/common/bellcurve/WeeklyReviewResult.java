package com.revenueplatform.common.bellcurve;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.revenueplatform.common.model.MarketState;
import com.revenueplatform.common.model.OperatingMode;
import com.revenueplatform.common.model.Recommendation;
import com.revenueplatform.common.model.RecommendationType;

import java.util.List;

public record WeeklyReviewResult(
    @JsonProperty("marketState")     MarketState marketState,
    @JsonProperty("operatingMode")   OperatingMode operatingMode,
    @JsonProperty("bellCurve")       BellCurveSummary bellCurve,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("counts")          Counts counts
) {

    public record BellCurveSummary(
        @JsonProperty("backHalfDays")    int backHalfDays,
        @JsonProperty("frontHalfDays")   int frontHalfDays,
        @JsonProperty("transitionPoint") double transitionPoint
    ) {}

    public record Counts(
        @JsonProperty("rateIncreases") long rateIncreases,
        @JsonProperty("priceDrops")    long priceDrops,
        @JsonProperty("promotions")    long promotions,
        @JsonProperty("total")         long total
    ) {
        public static Counts of(List<Recommendation> recommendations) {
            return new Counts(
                count(recommendations, RecommendationType.RATE_INCREASE),
                count(recommendations, RecommendationType.PRICE_DROP),
                count(recommendations, RecommendationType.APPLY_PROMOTION),
                recommendations.size());
        }

        private static long count(List<Recommendation> recommendations, RecommendationType type) {
            return recommendations.stream().filter(r -> r.type() == type).count();
        }
    }
}
