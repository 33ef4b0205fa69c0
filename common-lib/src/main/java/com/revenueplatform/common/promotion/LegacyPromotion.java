package com.revenueplatform.common.promotion;

/**
 * Outcome of the single-string velocity check used by the older weekly scan. Kept alongside
 * the structured scan for reports that still quote it.
 */
public enum LegacyPromotion {

    LAST_MINUTE_HERO("TRIGGERED: Last Minute Hero (20% Off)"),
    EARLY_BIRD_VELOCITY("TRIGGERED: Early Bird Velocity (15% Off)"),
    NO_ACTION("NO_ACTION");

    private final String label;

    LegacyPromotion(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
