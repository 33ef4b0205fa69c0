package com.revenueplatform.common.config;

import com.revenueplatform.common.model.ModeProfile;
import com.revenueplatform.common.model.OperatingMode;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable tunables for one {@code RevenueDecisionEngine} instance.
 *
 * <p>Built once at engine construction via {@link #defaults()} plus the optional
 * withers below; there is no runtime reconfiguration. Grouped by the component
 * that reads them:
 * <ul>
 *   <li>{@link Aps}: score bounds, PID weights, peak multiplier</li>
 *   <li>{@code minComps}: comparable tier acceptance threshold</li>
 *   <li>{@link Monthly}: error-forecasting thresholds and caps</li>
 *   <li>{@link Weekly}: bell curve windows, decay and rule thresholds</li>
 *   <li>{@link MarketStateThresholds}: HOT / COLD cut-offs</li>
 *   <li>operating mode profiles and sliding-scale brackets</li>
 *   <li>{@link Promotions}: promotion-scanner rules</li>
 * </ul>
 */
public record EngineSettings(
    Aps aps,
    int minComps,
    Monthly monthly,
    Weekly weekly,
    MarketStateThresholds marketState,
    Map<OperatingMode, ModeProfile> modeProfiles,
    List<DiscountBracket> slidingScale,
    Promotions promotions
) {

    // ── APS ──────────────────────────────────────────────────────────────
    private static final double APS_MIN             = 0.80;
    private static final double APS_MAX             = 1.60;
    private static final double PID_HISTORY         = 0.70;
    private static final double PID_INDEX           = 0.30;
    private static final double PEAK_ADR_MULTIPLIER = 1.25;

    /** Minimum comparable sample size before a tier is accepted. */
    private static final int MIN_COMPS = 10;

    public EngineSettings {
        modeProfiles = Map.copyOf(modeProfiles);
        slidingScale = List.copyOf(slidingScale);
        for (OperatingMode mode : OperatingMode.values()) {
            if (!modeProfiles.containsKey(mode)) {
                throw new IllegalArgumentException("Missing operating mode profile: " + mode);
            }
        }
        if (slidingScale.isEmpty()) {
            throw new IllegalArgumentException("Sliding scale needs at least one bracket");
        }
    }

    public static EngineSettings defaults() {
        Map<OperatingMode, ModeProfile> modes = new EnumMap<>(OperatingMode.class);
        modes.put(OperatingMode.AGGRESSIVE, new ModeProfile(OperatingMode.AGGRESSIVE, 0.05, 0.15, 0.10));
        modes.put(OperatingMode.STANDARD,   new ModeProfile(OperatingMode.STANDARD,   0.10, 0.20, 0.15));
        modes.put(OperatingMode.DEFENSIVE,  new ModeProfile(OperatingMode.DEFENSIVE,  0.15, 0.30, 0.15));

        List<DiscountBracket> brackets = List.of(
            new DiscountBracket(0,  3,                 2.0,  "0-3d (2x)"),
            new DiscountBracket(4,  7,                 1.5,  "4-7d (1.5x)"),
            new DiscountBracket(8,  14,                1.25, "8-14d (1.25x)"),
            new DiscountBracket(15, 30,                1.0,  "15-30d (1x)"),
            new DiscountBracket(31, Integer.MAX_VALUE, 0.75, "31+d (0.75x)")
        );

        return new EngineSettings(
            new Aps(APS_MIN, APS_MAX, PID_HISTORY, PID_INDEX, PEAK_ADR_MULTIPLIER),
            MIN_COMPS,
            Monthly.defaults(),
            Weekly.defaults(),
            new MarketStateThresholds(0.75, 0.45, 1.10, 0.90),
            modes,
            brackets,
            Promotions.defaults()
        );
    }

    public ModeProfile profileFor(OperatingMode mode) {
        return modeProfiles.get(mode);
    }

    public EngineSettings withAuditLookaheadDays(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Audit lookahead must be positive, got " + days);
        }
        Weekly w = weekly;
        Weekly updated = new Weekly(days, w.forwardBookingWindow(), w.decayWindowPercentage(),
            w.minDecayMultiplier(), w.apsJustifiedPriceThreshold(), w.earlyDemandOccMultiplier(),
            w.earlyDemandFullStrengthMultiplier(), w.earlyDemandRateIncreaseMin(),
            w.earlyDemandRateIncreaseMax(), w.frontHalfLaggingThreshold(), w.minMarketOccupancy());
        return new EngineSettings(aps, minComps, monthly, updated, marketState,
            modeProfiles, slidingScale, promotions);
    }

    public EngineSettings withApsBounds(double min, double max) {
        if (min <= 0 || max < min) {
            throw new IllegalArgumentException(
                String.format("Invalid APS bounds [%.2f, %.2f]", min, max));
        }
        Aps updated = new Aps(min, max, aps.historyWeight(), aps.indexWeight(), aps.peakAdrMultiplier());
        return new EngineSettings(updated, minComps, monthly, weekly, marketState,
            modeProfiles, slidingScale, promotions);
    }

    // ── groups ───────────────────────────────────────────────────────────

    public record Aps(
        double min,
        double max,
        double historyWeight,
        double indexWeight,
        double peakAdrMultiplier
    ) {}

    public record Monthly(
        double minRevparThreshold,
        double minOccupancyThreshold,
        double minAdrThreshold,
        double underpricingOccMultiplier,
        double underpricingRevparMultiplier,
        double overpricingOccMultiplier,
        double overpricingRevparMultiplier,
        double overpricingCorrectionFactor,
        double underpricingFallbackCorrection,
        double correctionSmoothingDivisor,
        double maxUpwardCorrection,
        double maxDownwardCorrection
    ) {
        static Monthly defaults() {
            return new Monthly(
                1.0, 0.01, 1.0,
                1.5, 0.8,
                0.7, 0.8,
                0.90, 2.0,
                2,
                1.50,   // never increase >50% in one month
                0.80    // never decrease >20% in one month
            );
        }
    }

    public record Weekly(
        int auditLookaheadDays,
        int forwardBookingWindow,
        double decayWindowPercentage,
        double minDecayMultiplier,
        double apsJustifiedPriceThreshold,
        double earlyDemandOccMultiplier,
        double earlyDemandFullStrengthMultiplier,
        double earlyDemandRateIncreaseMin,
        double earlyDemandRateIncreaseMax,
        double frontHalfLaggingThreshold,
        double minMarketOccupancy
    ) {
        static Weekly defaults() {
            return new Weekly(14, 90, 0.30, 0.70, 0.10, 2.5, 5.0, 0.20, 0.25, 0.20, 0.01);
        }

        /** Day offset separating back half from front half; also the APS decay window. */
        public double transitionPoint() {
            return forwardBookingWindow * decayWindowPercentage;
        }
    }

    public record MarketStateThresholds(
        double hotOccupancy,
        double coldOccupancy,
        double hotPace,
        double coldPace
    ) {}

    public record Promotions(
        double velocityGapThreshold,
        double velocityDiscount,
        int lastMinuteMaxDaysOut,
        double lastMinuteOccThreshold,
        double lastMinuteDiscount,
        double extendedStayPropertyMaxAvgStay,
        double extendedStayMarketMinAvgStay,
        double extendedStayDiscount,
        String extendedStayLabel,
        int legacyLastMinuteMaxDays,
        double legacyLastMinuteDiscount,
        int legacyEarlyBirdMaxDays,
        double legacyEarlyBirdDiscount
    ) {
        static Promotions defaults() {
            return new Promotions(
                0.15, 0.15,
                7, 0.50, 0.20,
                3, 4, 0.10, "10% for 5+ nights",
                14, 0.20,
                60, 0.15
            );
        }
    }
}
