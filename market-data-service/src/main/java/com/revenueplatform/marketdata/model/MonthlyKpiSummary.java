package com.revenueplatform.marketdata.model;

/** Historical averages over the monthly KPI rows; {@code dataPoints} counts every row. */
public record MonthlyKpiSummary(
    double marketRevPAR,
    double annualRevPAR,
    double avgOccupancy,
    double avgADR,
    double peakADR,
    int dataPoints
) {}
