package com.revenueplatform.common.formula;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.model.MarketData;
import com.revenueplatform.common.model.PropertyData;

/**
 * Core formulas behind the Adaptive Performance Score (APS) and the price bounds.
 *
 * <p>APS is a single-step exponentially smoothed score: 70% of the previous score,
 * 30% of the current RevPAR index, clamped to {@code [aps.min, aps.max]}.
 *
 * <p>Pure and stateless. Inputs are assumed finite; the only guarded denominator is
 * the market RevPAR of the performance index.
 */
public final class RevenueFormulas {

    private final EngineSettings.Aps apsSettings;

    public RevenueFormulas(EngineSettings settings) {
        this.apsSettings = settings.aps();
    }

    public double performanceIndex(double myRevPAR, double marketRevPAR) {
        if (marketRevPAR <= 0) return 1.0;
        return myRevPAR / marketRevPAR;
    }

    public double newAps(double previousAps, double performanceIndex) {
        double blended = previousAps * apsSettings.historyWeight() + performanceIndex * apsSettings.indexWeight();
        return Math.max(apsSettings.min(), Math.min(blended, apsSettings.max()));
    }

    public double annualTarget(double totalMarketAnnualRevPAR, double aps) {
        return totalMarketAnnualRevPAR * aps;
    }

    /** Floor never sits below either the market's 20th percentile or last year's lowest sale. */
    public double minPrice(double market20thPctlADR, double lastYearLowestSold) {
        return Math.max(market20thPctlADR, lastYearLowestSold);
    }

    public double maxPrice(double peakFutureADR, double aps) {
        return peakFutureADR * aps * apsSettings.peakAdrMultiplier();
    }

    public double dynamicCentroid(double avgFutureMarketADR, double aps) {
        return avgFutureMarketADR * aps;
    }

    public double basePrice(double avgADR, double aps) {
        return avgADR * aps;
    }

    /**
     * Runs every formula for one property/market pair.
     *
     * @param previousAps the score carried over from the last run
     * @return all seven core outputs; never null
     */
    public CoreMetrics compute(PropertyData property, MarketData market, double previousAps) {
        double index  = performanceIndex(property.myRevPAR(), market.marketRevPAR());
        double newAps = newAps(previousAps, index);
        return new CoreMetrics(
            index,
            newAps,
            annualTarget(market.totalMarketAnnualRevPAR(), newAps),
            minPrice(market.market20thPctlADR(), property.lastYearLowestSold()),
            maxPrice(market.peakFutureADR(), newAps),
            dynamicCentroid(market.avgFutureMarketADR(), newAps),
            basePrice(market.avgADR(), newAps)
        );
    }
}
