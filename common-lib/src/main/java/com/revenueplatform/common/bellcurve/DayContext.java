package com.revenueplatform.common.bellcurve;

import com.revenueplatform.common.model.MarketState;
import com.revenueplatform.common.model.ModeProfile;

import java.time.LocalDate;

/**
 * Run-wide inputs for {@link BellCurveScheduler#auditDay}. The audited stay date is
 * {@code runDate + daysToArrival}.
 */
public record DayContext(
    LocalDate runDate,
    double ourOcc,
    double ourPrice,
    double marketOcc,
    double fairMarketPrice,
    double fullAps,
    MarketState marketState,
    ModeProfile mode
) {}
