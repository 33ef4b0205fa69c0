package com.revenueplatform.common.bellcurve;

import com.revenueplatform.common.model.BookingPhase;

public record BookingPhaseResult(
    BookingPhase phase,
    String goal,
    int daysToArrival,
    double transitionPoint
) {}
