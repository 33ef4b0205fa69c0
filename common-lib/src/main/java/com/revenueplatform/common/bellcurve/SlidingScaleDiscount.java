package com.revenueplatform.common.bellcurve;

import com.revenueplatform.common.config.DiscountBracket;
import com.revenueplatform.common.config.EngineSettings;

import java.util.List;

/**
 * Day-out sliding scale applied to an operating mode's base discount.
 *
 * <pre>
 *   0–3 days  → base × 2.0
 *   4–7       → base × 1.5
 *   8–14      → base × 1.25
 *   15–30     → base × 1.0
 *   31+       → base × 0.75
 * </pre>
 * The result never exceeds the mode's max discount.
 */
public final class SlidingScaleDiscount {

    private final List<DiscountBracket> brackets;

    public SlidingScaleDiscount(EngineSettings settings) {
        this.brackets = settings.slidingScale();
    }

    public SlidingScaleResult calculate(double baseDiscount, double maxDiscount, int daysToArrival) {
        DiscountBracket bracket = bracketFor(daysToArrival);

        double calculated = baseDiscount * bracket.multiplier();
        double finalDiscount = Math.min(calculated, maxDiscount);

        return new SlidingScaleResult(baseDiscount, bracket.multiplier(), calculated, finalDiscount,
            bracket.label(), calculated > maxDiscount);
    }

    /** Ascending scan, first inclusive match; out-of-range days use the last bracket. */
    DiscountBracket bracketFor(int daysToArrival) {
        for (DiscountBracket b : brackets) {
            if (b.contains(daysToArrival)) {
                return b;
            }
        }
        return brackets.get(brackets.size() - 1);
    }
}
