package com.revenueplatform.common.bellcurve;

/** Effective APS for a front-half date after linear close-in decay. */
public record ApsDecayResult(
    double effectiveAps,
    boolean decayApplied,
    double decayMultiplier,
    int daysToArrival
) {}
