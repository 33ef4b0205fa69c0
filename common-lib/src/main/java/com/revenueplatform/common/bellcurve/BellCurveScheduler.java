package com.revenueplatform.common.bellcurve;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.model.BookingPhase;
import com.revenueplatform.common.model.MarketState;
import com.revenueplatform.common.model.ModeProfile;
import com.revenueplatform.common.model.OperatingMode;
import com.revenueplatform.common.model.Recommendation;
import com.revenueplatform.common.model.RecommendationType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Weekly tactical review. Walks the next {@code auditLookaheadDays} stay dates
 * along the booking curve and emits at most one recommendation per date.
 *
 * <h3>Booking curve</h3>
 * <pre>
 *   transitionPoint = forwardBookingWindow × decayWindowPercentage   (90 × 0.30 = 27)
 *   daysToArrival &gt; 27  → BACK_HALF   maximize ADR
 *   daysToArrival ≤ 27  → FRONT_HALF  maximize occupancy
 * </pre>
 *
 * <h3>Rules per date</h3>
 * <ul>
 *   <li><b>Back half, early demand:</b> our occupancy above 2.5x market pace → RATE_INCREASE
 *       of 20% scaling to 25% at 5.0x.</li>
 *   <li><b>Front half, lagging occupancy:</b> our occupancy below 80% of market →
 *       PRICE_DROP to the APS-justified price when we sit more than 10% above it,
 *       otherwise APPLY_PROMOTION using the {@link SlidingScaleDiscount}.</li>
 * </ul>
 *
 * <p>Front-half APS decays linearly from 1.0x at the transition point to 0.70x on the
 * arrival day. Market state is evaluated once per run, never per day.
 *
 * <p>Stateless: {@link #auditDay(int, DayContext)} is a pure function of its inputs and a
 * date without a matching rule yields {@link Optional#empty()}, never a NO_ACTION record.
 */
public final class BellCurveScheduler {

    private final EngineSettings settings;
    private final EngineSettings.Weekly weekly;
    private final SlidingScaleDiscount slidingScale;

    public BellCurveScheduler(EngineSettings settings) {
        this.settings     = settings;
        this.weekly       = settings.weekly();
        this.slidingScale = new SlidingScaleDiscount(settings);
    }

    // ── classification ─────────────────────────────────────────────────

    public BookingPhaseResult bookingPhase(int daysToArrival) {
        double transitionPoint = weekly.transitionPoint();
        BookingPhase phase = daysToArrival > transitionPoint ? BookingPhase.BACK_HALF : BookingPhase.FRONT_HALF;
        return new BookingPhaseResult(phase, phase.goal(), daysToArrival, transitionPoint);
    }

    public MarketState marketState(double forwardOccupancy, double historicalOccupancyPace) {
        EngineSettings.MarketStateThresholds t = settings.marketState();
        double paceRatio = historicalOccupancyPace > 0
            ? forwardOccupancy / historicalOccupancyPace
            : 1.0;

        if (forwardOccupancy >= t.hotOccupancy() || paceRatio >= t.hotPace()) {
            return MarketState.HOT;
        }
        if (forwardOccupancy <= t.coldOccupancy() || paceRatio <= t.coldPace()) {
            return MarketState.COLD;
        }
        return MarketState.NEUTRAL;
    }

    public ModeProfile operatingMode(MarketState state) {
        return settings.profileFor(OperatingMode.forState(state));
    }

    // ── pricing helpers ────────────────────────────────────────────────

    public ApsDecayResult apsDecay(double fullAps, int daysToArrival) {
        double decayWindow = weekly.transitionPoint();

        if (daysToArrival >= decayWindow) {
            return new ApsDecayResult(fullAps, false, 1.0, daysToArrival);
        }

        double decayProgress   = (decayWindow - daysToArrival) / decayWindow;
        double decayMultiplier = 1.0 - decayProgress * (1.0 - weekly.minDecayMultiplier());
        return new ApsDecayResult(fullAps * decayMultiplier, true, decayMultiplier, daysToArrival);
    }

    public MarketAlignmentResult marketAlignment(double ourPrice, double fairMarketPrice,
                                                 double fullAps, int daysToArrival) {
        ApsDecayResult decay = apsDecay(fullAps, daysToArrival);
        double apsAdjustedPrice    = fairMarketPrice * decay.effectiveAps();
        double maxJustifiablePrice = apsAdjustedPrice * (1 + weekly.apsJustifiedPriceThreshold());
        double priceGap = apsAdjustedPrice > 0 ? (ourPrice - apsAdjustedPrice) / apsAdjustedPrice : 0;

        return new MarketAlignmentResult(ourPrice > maxJustifiablePrice, ourPrice, fairMarketPrice,
            decay.effectiveAps(), apsAdjustedPrice, maxJustifiablePrice, priceGap, decay.decayApplied());
    }

    public SlidingScaleResult slidingScale(ModeProfile mode, int daysToArrival) {
        return slidingScale.calculate(mode.baseDiscount(), mode.maxDiscount(), daysToArrival);
    }

    // ── per-day audit ──────────────────────────────────────────────────

    /**
     * Audits a single stay date.
     *
     * @param daysToArrival offset from the run date
     * @param ctx           run-wide inputs
     * @return the recommendation for that date, or empty when no rule fires
     */
    public Optional<Recommendation> auditDay(int daysToArrival, DayContext ctx) {
        LocalDate date = ctx.runDate().plusDays(daysToArrival);
        return switch (bookingPhase(daysToArrival).phase()) {
            case BACK_HALF  -> earlyDemand(date, ctx);
            case FRONT_HALF -> laggingOccupancy(date, daysToArrival, ctx);
        };
    }

    private Optional<Recommendation> earlyDemand(LocalDate date, DayContext ctx) {
        double demandMultiplier = ctx.ourOcc() / Math.max(ctx.marketOcc(), weekly.minMarketOccupancy());
        if (demandMultiplier <= weekly.earlyDemandOccMultiplier()) {
            return Optional.empty();
        }

        double span     = weekly.earlyDemandFullStrengthMultiplier() - weekly.earlyDemandOccMultiplier();
        double strength = Math.min((demandMultiplier - weekly.earlyDemandOccMultiplier()) / span, 1);
        double pct = weekly.earlyDemandRateIncreaseMin()
            + strength * (weekly.earlyDemandRateIncreaseMax() - weekly.earlyDemandRateIncreaseMin());

        return Optional.of(new Recommendation(
            date,
            RecommendationType.RATE_INCREASE,
            String.format("+%.0f%%", pct * 100),
            ctx.ourPrice(),
            ctx.ourPrice() * (1 + pct),
            String.format("Early demand: our occ %.1f%% is %.1fx market pace.",
                ctx.ourOcc() * 100, demandMultiplier),
            BookingPhase.BACK_HALF,
            ctx.marketState(),
            ctx.mode().mode()));
    }

    private Optional<Recommendation> laggingOccupancy(LocalDate date, int daysToArrival, DayContext ctx) {
        double target = ctx.marketOcc() * (1 - weekly.frontHalfLaggingThreshold());
        if (ctx.ourOcc() >= target) {
            return Optional.empty();
        }

        MarketAlignmentResult alignment =
            marketAlignment(ctx.ourPrice(), ctx.fairMarketPrice(), ctx.fullAps(), daysToArrival);

        if (alignment.overpriced()) {
            return Optional.of(new Recommendation(
                date,
                RecommendationType.PRICE_DROP,
                String.format("$%.2f", alignment.apsAdjustedPrice()),
                ctx.ourPrice(),
                alignment.apsAdjustedPrice(),
                String.format("Price $%.2f exceeds APS-justified $%.2f by %.0f%%.",
                    ctx.ourPrice(), alignment.apsAdjustedPrice(), alignment.priceGapPercentage() * 100),
                BookingPhase.FRONT_HALF,
                ctx.marketState(),
                ctx.mode().mode()));
        }

        SlidingScaleResult discount = slidingScale(ctx.mode(), daysToArrival);
        return Optional.of(new Recommendation(
            date,
            RecommendationType.APPLY_PROMOTION,
            String.format("%.0f%% off", discount.finalDiscount() * 100),
            ctx.ourPrice(),
            ctx.ourPrice() * (1 - discount.finalDiscount()),
            String.format("Pacing slow (our %.1f%% vs market %.1f%%). Bracket %s.",
                ctx.ourOcc() * 100, ctx.marketOcc() * 100, discount.bracketLabel()),
            BookingPhase.FRONT_HALF,
            ctx.marketState(),
            ctx.mode().mode()));
    }

    // ── weekly review ──────────────────────────────────────────────────

    /**
     * Runs the audit over offsets {@code 0 .. auditLookaheadDays - 1}.
     *
     * @param forwardOccupancy        market forward occupancy; also each date's market pace
     * @param historicalOccupancyPace market historical occupancy for the pace ratio
     * @param fairMarketPrice         market average ADR
     */
    public WeeklyReviewResult runWeeklyReview(LocalDate runDate,
                                              double propertyOcc,
                                              double currentPrice,
                                              double fullAps,
                                              double forwardOccupancy,
                                              double historicalOccupancyPace,
                                              double fairMarketPrice) {
        MarketState state = marketState(forwardOccupancy, historicalOccupancyPace);
        ModeProfile mode  = operatingMode(state);
        DayContext ctx = new DayContext(runDate, propertyOcc, currentPrice, forwardOccupancy,
            fairMarketPrice, fullAps, state, mode);

        int lookahead = weekly.auditLookaheadDays();
        int backHalfDays = (int) IntStream.range(0, lookahead)
            .filter(d -> bookingPhase(d).phase() == BookingPhase.BACK_HALF)
            .count();

        List<Recommendation> recommendations = IntStream.range(0, lookahead)
            .mapToObj(d -> auditDay(d, ctx))
            .flatMap(Optional::stream)
            .toList();

        return new WeeklyReviewResult(
            state,
            mode.mode(),
            new WeeklyReviewResult.BellCurveSummary(backHalfDays, lookahead - backHalfDays,
                weekly.transitionPoint()),
            recommendations,
            WeeklyReviewResult.Counts.of(recommendations));
    }
}
