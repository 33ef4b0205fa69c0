package com.revenueplatform.marketdata.model;

/** Forward pacing averages; only rows carrying both occupancy and ADR are counted. */
public record WeeklyKpiSummary(
    double occupancy,
    double futureADR,
    double futureRevPAR,
    int dataPoints
) {}
