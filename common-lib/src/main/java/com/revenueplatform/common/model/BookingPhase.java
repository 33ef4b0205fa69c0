package com.revenueplatform.common.model;

/**
 * Position of a stay date on the booking curve.
 * Far-out dates chase rate, close-in dates chase occupancy.
 */
public enum BookingPhase {

    BACK_HALF("MAXIMIZE_ADR"),

    FRONT_HALF("MAXIMIZE_OCCUPANCY");

    private final String goal;

    BookingPhase(String goal) {
        this.goal = goal;
    }

    public String goal() {
        return goal;
    }
}
