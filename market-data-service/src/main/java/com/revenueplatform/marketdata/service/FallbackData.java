package com.revenueplatform.marketdata.service;

import com.revenueplatform.common.model.ComparableSelection;
import com.revenueplatform.common.model.ComparableTier;
import com.revenueplatform.common.model.MarketData;
import com.revenueplatform.common.model.PropertyData;

/**
 * Fixed metrics served when an upstream is unreachable or unconfigured
 * (a Maui comp set and a representative listing).
 */
public final class FallbackData {

    public static final MarketData MARKET = new MarketData(
        189.50,     // marketRevPAR
        0.72,       // marketOccupancy
        155.00,     // market20thPctlADR
        485.00,     // peakFutureADR
        310.00,     // avgFutureMarketADR
        69_178,     // totalMarketAnnualRevPAR
        263.19,     // avgADR
        4.8,        // avgBookingLength
        null        // forwardOccupancy
    );

    public static final PropertyData PROPERTY = new PropertyData(
        215.75,     // myRevPAR
        0.58,       // myOccupancy
        139.00,     // lastYearLowestSold
        349.00,     // currentPrice
        371.98,     // myADR
        2.4         // avgBookingLength
    );

    private FallbackData() {}

    public static ComparableSelection marketSelection() {
        return new ComparableSelection(ComparableTier.WHOLE_MARKET, null, MARKET, 0);
    }
}
