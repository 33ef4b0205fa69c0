package com.revenueplatform.common.engine;

import com.revenueplatform.common.bellcurve.BellCurveScheduler;
import com.revenueplatform.common.bellcurve.WeeklyReviewResult;
import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.forecast.ErrorForecaster;
import com.revenueplatform.common.forecast.MonthlyReviewResult;
import com.revenueplatform.common.formula.CoreMetrics;
import com.revenueplatform.common.formula.RevenueFormulas;
import com.revenueplatform.common.model.MarketData;
import com.revenueplatform.common.model.PropertyData;
import com.revenueplatform.common.model.Recommendation;
import com.revenueplatform.common.promotion.LegacyPromotion;
import com.revenueplatform.common.promotion.PromotionScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Single entry point of the revenue engine.
 *
 * <h3>Pipeline</h3>
 * <pre>
 * PropertyData + MarketData + previousAps
 *   → RevenueFormulas     performance index, new APS, price bounds, centroid
 *   → ErrorForecaster     monthly diagnosis and target-rent correction
 *   → BellCurveScheduler  weekly per-day recommendations
 *   → PromotionScanner    run-level promotions + legacy velocity check
 *   → EngineResult
 * </pre>
 *
 * <h3>Wiring</h3>
 * <ul>
 *   <li>The monthly review bootstraps a missing target rent from {@code previousAps}.</li>
 *   <li>The weekly review prices with the new APS. Forward occupancy is
 *       {@link MarketData#effectiveForwardOccupancy()}, the historical pace is
 *       {@code marketOccupancy} and the fair market price is {@code avgADR}.</li>
 *   <li>The scanner uses the centroid at the new APS and the weekly market state.</li>
 * </ul>
 *
 * <p>Stateless apart from its settings; one instance may be shared across threads.
 */
public final class RevenueDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(RevenueDecisionEngine.class);

    private final Clock clock;
    private final RevenueFormulas formulas;
    private final ErrorForecaster forecaster;
    private final BellCurveScheduler bellCurve;
    private final PromotionScanner scanner;

    public RevenueDecisionEngine(EngineSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        this.clock      = Objects.requireNonNull(clock, "clock");
        this.formulas   = new RevenueFormulas(settings);
        this.forecaster = new ErrorForecaster(settings);
        this.bellCurve  = new BellCurveScheduler(settings);
        this.scanner    = new PromotionScanner(settings);
    }

    public EngineResult run(EngineInput input) {
        PropertyData property = Objects.requireNonNull(input.propertyData(), "propertyData");
        MarketData market     = Objects.requireNonNull(input.marketData(), "marketData");
        LocalDate runDate     = LocalDate.now(clock);

        CoreMetrics core = formulas.compute(property, market, input.previousAps());

        MonthlyReviewResult monthly = forecaster.review(
            property.myOccupancy(), property.myRevPAR(),
            market.marketOccupancy(), market.marketRevPAR(),
            input.currentTargetRent(), input.previousAps(),
            market.totalMarketAnnualRevPAR(), core.newAps());

        WeeklyReviewResult weekly = bellCurve.runWeeklyReview(
            runDate,
            property.myOccupancy(),
            property.currentPrice(),
            core.newAps(),
            market.effectiveForwardOccupancy(),
            market.marketOccupancy(),
            market.avgADR());

        List<Recommendation> promotions = scanner.scanAll(
            runDate,
            property.myOccupancy(),
            market.marketOccupancy(),
            property.currentPrice(),
            core.dynamicCentroid(),
            input.daysOut(),
            weekly.marketState(),
            property.avgBookingLength(),
            market.avgBookingLength());

        LegacyPromotion legacy = scanner.evaluateLegacyVelocity(
            input.daysOut(), property.myOccupancy(), market.marketOccupancy(),
            property.currentPrice(), core.dynamicCentroid());

        log.info("[Engine] run complete runDate={} newAps={} diagnosis={} state={} recommendations={} promotions={}",
            runDate, String.format("%.4f", core.newAps()), monthly.diagnosis().type(),
            weekly.marketState(), weekly.counts().total(), promotions.size());

        return new EngineResult(runDate, core, monthly, weekly, promotions, legacy);
    }
}
