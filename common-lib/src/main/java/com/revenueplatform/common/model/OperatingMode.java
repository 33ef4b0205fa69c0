package com.revenueplatform.common.model;

/**
 * Discount aggressiveness selected from the {@link MarketState}. The numbers for each
 * mode live in {@link ModeProfile}.
 */
public enum OperatingMode {

    AGGRESSIVE("Aggressive"),
    STANDARD("Standard"),
    DEFENSIVE("Defensive");

    private final String displayName;

    OperatingMode(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static OperatingMode forState(MarketState state) {
        return switch (state) {
            case HOT     -> AGGRESSIVE;
            case COLD    -> DEFENSIVE;
            case NEUTRAL -> STANDARD;
        };
    }
}
