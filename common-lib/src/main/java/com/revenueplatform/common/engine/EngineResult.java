package com.revenueplatform.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.revenueplatform.common.bellcurve.WeeklyReviewResult;
import com.revenueplatform.common.forecast.MonthlyReviewResult;
import com.revenueplatform.common.formula.CoreMetrics;
import com.revenueplatform.common.model.Recommendation;
import com.revenueplatform.common.promotion.LegacyPromotion;

import java.time.LocalDate;
import java.util.List;

public record EngineResult(
    @JsonProperty("runDate")         LocalDate runDate,
    @JsonProperty("core")            CoreMetrics core,
    @JsonProperty("monthlyReview")   MonthlyReviewResult monthlyReview,
    @JsonProperty("weeklyReview")    WeeklyReviewResult weeklyReview,
    @JsonProperty("promotions")      List<Recommendation> promotions,
    @JsonProperty("legacyPromotion") LegacyPromotion legacyPromotion
) {}
