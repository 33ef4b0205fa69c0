package com.revenueplatform.common.model;

/**
 * Comparable-set strictness levels, strictest first. The declaration order is the
 * fallback order used by {@code ComparableFilterSelector}.
 */
public enum ComparableTier {

    /** Bedrooms + property type + sleeps + amenities. */
    STRICT("Strict"),

    /** Bedrooms + sleeps. */
    STANDARD("Standard"),

    /** Bedrooms only. */
    BROAD("Broad"),

    /** No filter. */
    WHOLE_MARKET("Whole Market");

    private final String label;

    ComparableTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Narrows the full filter set to this tier. Returns {@code null} for
     * {@link #WHOLE_MARKET}, which the market source reads as "no filter".
     */
    public ComparableFilters narrow(ComparableFilters full) {
        if (full == null) {
            return null;
        }
        return switch (this) {
            case STRICT       -> full;
            case STANDARD     -> full.standard();
            case BROAD        -> full.broad();
            case WHOLE_MARKET -> null;
        };
    }
}
