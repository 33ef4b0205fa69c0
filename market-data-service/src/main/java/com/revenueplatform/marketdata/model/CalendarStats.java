package com.revenueplatform.marketdata.model;

/**
 * Performance over a calendar window. Blocked nights are excluded from
 * {@code availableNights}; {@code lowestSoldPrice} is 0 when nothing sold.
 */
public record CalendarStats(
    double revPAR,
    double occupancy,
    double adr,
    double lowestSoldPrice,
    double totalRevenue,
    int bookedNights,
    int availableNights
) {
    public static final CalendarStats EMPTY = new CalendarStats(0, 0, 0, 0, 0, 0, 0);
}
