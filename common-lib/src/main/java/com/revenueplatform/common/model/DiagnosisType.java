package com.revenueplatform.common.model;

/**
 * Discriminant of the monthly error-forecasting diagnosis.
 *
 * <ul>
 *   <li>{@link #CLASSIC_UNDERPRICING}: bought occupancy with low prices.</li>
 *   <li>{@link #CLASSIC_OVERPRICING}: high prices deterred bookings.</li>
 *   <li>{@link #ACCEPTABLE_PERFORMANCE}: within bounds, no correction.</li>
 * </ul>
 */
public enum DiagnosisType {
    CLASSIC_UNDERPRICING,
    CLASSIC_OVERPRICING,
    ACCEPTABLE_PERFORMANCE
}
