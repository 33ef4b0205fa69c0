package com.revenueplatform.common.bellcurve;

/**
 * Comparison of our price with the APS-justified market price.
 * {@code overpriced} holds when our price exceeds {@code maxJustifiablePrice}.
 */
public record MarketAlignmentResult(
    boolean overpriced,
    double ourPrice,
    double fairMarketPrice,
    double effectiveAps,
    double apsAdjustedPrice,
    double maxJustifiablePrice,
    double priceGapPercentage,
    boolean decayApplied
) {}
