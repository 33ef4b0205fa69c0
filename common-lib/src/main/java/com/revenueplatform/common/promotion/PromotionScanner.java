package com.revenueplatform.common.promotion;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.model.BookingPhase;
import com.revenueplatform.common.model.MarketState;
import com.revenueplatform.common.model.Recommendation;
import com.revenueplatform.common.model.RecommendationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Run-level promotion rules, evaluated once against the run date. Every rule that
 * matches contributes one recommendation; the rules are independent.
 *
 * <pre>
 *   velocity gap   marketOcc − ourOcc &gt; 0.15 and price above centroid → APPLY_PROMOTION
 *   last minute    daysOut ≤ 7 and ourOcc &lt; 0.50                      → LAST_MINUTE_DEAL
 *   extended stay  our stay &lt; 3 nights, market stay ≥ 4 nights        → EXTENDED_STAY_INCENTIVE
 * </pre>
 */
public final class PromotionScanner {

    private static final Logger log = LoggerFactory.getLogger(PromotionScanner.class);

    private final EngineSettings.Promotions rules;

    public PromotionScanner(EngineSettings settings) {
        this.rules = settings.promotions();
    }

    /**
     * @param propertyAvgStay null when unknown; the extended-stay rule is then skipped
     * @param marketAvgStay   null when unknown; the extended-stay rule is then skipped
     */
    public List<Recommendation> scanAll(LocalDate runDate,
                                        double ourOcc,
                                        double marketOcc,
                                        double currentPrice,
                                        double dynamicCentroid,
                                        int daysOut,
                                        MarketState marketState,
                                        Double propertyAvgStay,
                                        Double marketAvgStay) {
        List<Recommendation> found = new ArrayList<>();

        double velocityGap = marketOcc - ourOcc;
        if (velocityGap > rules.velocityGapThreshold() && currentPrice > dynamicCentroid) {
            found.add(new Recommendation(
                runDate,
                RecommendationType.APPLY_PROMOTION,
                String.format("%.0f%% off", rules.velocityDiscount() * 100),
                currentPrice,
                dynamicCentroid * (1 - rules.velocityDiscount()),
                String.format("Velocity gap %.1f%% exceeds %.0f%% threshold and price $%.2f above centroid $%.2f.",
                    velocityGap * 100, rules.velocityGapThreshold() * 100, currentPrice, dynamicCentroid),
                null,
                marketState,
                null));
        }

        if (daysOut <= rules.lastMinuteMaxDaysOut() && ourOcc < rules.lastMinuteOccThreshold()) {
            found.add(new Recommendation(
                runDate,
                RecommendationType.LAST_MINUTE_DEAL,
                String.format("%.0f%% off", rules.lastMinuteDiscount() * 100),
                currentPrice,
                dynamicCentroid * (1 - rules.lastMinuteDiscount()),
                String.format("Low occupancy (%.1f%%) with only %d days out.", ourOcc * 100, daysOut),
                BookingPhase.FRONT_HALF,
                marketState,
                null));
        }

        if (propertyAvgStay != null && marketAvgStay != null
                && propertyAvgStay < rules.extendedStayPropertyMaxAvgStay()
                && marketAvgStay >= rules.extendedStayMarketMinAvgStay()) {
            found.add(new Recommendation(
                runDate,
                RecommendationType.EXTENDED_STAY_INCENTIVE,
                rules.extendedStayLabel(),
                currentPrice,
                currentPrice * (1 - rules.extendedStayDiscount()),
                String.format("Avg stay %.1f nights vs market %.1f nights.", propertyAvgStay, marketAvgStay),
                null,
                marketState,
                null));
        }

        log.debug("[Promotions] scanned daysOut={} velocityGap={} found={}",
            daysOut, String.format("%.3f", velocityGap), found.size());
        return List.copyOf(found);
    }

    /** Velocity check of the older weekly scan; price must sit strictly above the centroid. */
    public LegacyPromotion evaluateLegacyVelocity(int daysOut, double ourOcc, double marketOcc,
                                                  double currentPrice, double dynamicCentroid) {
        boolean lagging      = marketOcc - ourOcc > rules.velocityGapThreshold();
        boolean priceTooHigh = currentPrice > dynamicCentroid;

        if (lagging && priceTooHigh) {
            if (daysOut < rules.legacyLastMinuteMaxDays()) return LegacyPromotion.LAST_MINUTE_HERO;
            if (daysOut <= rules.legacyEarlyBirdMaxDays()) return LegacyPromotion.EARLY_BIRD_VELOCITY;
        }
        return LegacyPromotion.NO_ACTION;
    }
}
