package com.revenueplatform.common.config;

/**
 * One day-out bracket of the sliding scale. Both bounds are inclusive; the open-ended
 * last bracket uses {@link Integer#MAX_VALUE} as its upper bound.
 */
public record DiscountBracket(
    int minDays,
    int maxDays,
    double multiplier,
    String label
) {
    public boolean contains(int daysToArrival) {
        return daysToArrival >= minDays && daysToArrival <= maxDays;
    }
}
