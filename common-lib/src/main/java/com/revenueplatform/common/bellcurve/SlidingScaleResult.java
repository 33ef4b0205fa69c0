package com.revenueplatform.common.bellcurve;

public record SlidingScaleResult(
    double baseDiscount,
    double multiplier,
    double calculatedDiscount,
    double finalDiscount,
    String bracketLabel,
    boolean cappedByMax
) {}
