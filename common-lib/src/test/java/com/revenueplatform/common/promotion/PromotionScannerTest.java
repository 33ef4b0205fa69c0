package com.revenueplatform.common.promotion;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.model.BookingPhase;
import com.revenueplatform.common.model.MarketState;
import com.revenueplatform.common.model.Recommendation;
import com.revenueplatform.common.model.RecommendationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromotionScannerTest {

    private static final double EPS = 1e-6;
    private static final LocalDate RUN_DATE = LocalDate.of(2026, 5, 11);

    private final PromotionScanner scanner = new PromotionScanner(EngineSettings.defaults());

    private static Recommendation only(List<Recommendation> recs, RecommendationType type) {
        List<Recommendation> matching = recs.stream().filter(r -> r.type() == type).toList();
        assertEquals(1, matching.size(), "expected one " + type);
        return matching.get(0);
    }

    // ── scanAll() ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("scanAll()")
    class ScanAllTests {

        @Test
        @DisplayName("velocity gap with price above centroid → 15% off the centroid")
        void velocityGap() {
            List<Recommendation> recs = scanner.scanAll(RUN_DATE, 0.5, 0.7, 350, 300, 21,
                MarketState.NEUTRAL, null, null);

            Recommendation r = only(recs, RecommendationType.APPLY_PROMOTION);
            assertEquals(1, recs.size());
            assertEquals("15% off", r.value());
            assertEquals(255, r.suggestedPrice(), EPS);
            assertEquals(RUN_DATE, r.date());
            assertNull(r.phase());
            assertNull(r.operatingMode());
            assertEquals("Velocity gap 20.0% exceeds 15% threshold and price $350.00 above centroid $300.00.",
                r.rationale());
        }

        @Test
        @DisplayName("velocity gap alone is not enough when price is at the centroid")
        void velocityGapPriceAtCentroid() {
            assertTrue(scanner.scanAll(RUN_DATE, 0.5, 0.7, 300, 300, 21,
                MarketState.NEUTRAL, null, null).isEmpty());
        }

        @Test
        @DisplayName("close-in and under 50% occupancy → last-minute deal at 80% of centroid")
        void lastMinute() {
            List<Recommendation> recs = scanner.scanAll(RUN_DATE, 0.4, 0.45, 250, 300, 5,
                MarketState.COLD, null, null);

            Recommendation r = only(recs, RecommendationType.LAST_MINUTE_DEAL);
            assertEquals("20% off", r.value());
            assertEquals(240, r.suggestedPrice(), EPS);
            assertEquals(BookingPhase.FRONT_HALF, r.phase());
            assertEquals(MarketState.COLD, r.marketState());
            assertEquals("Low occupancy (40.0%) with only 5 days out.", r.rationale());
        }

        @Test
        @DisplayName("day 8 is outside the last-minute window")
        void lastMinuteWindow() {
            assertTrue(scanner.scanAll(RUN_DATE, 0.4, 0.45, 250, 300, 8,
                MarketState.COLD, null, null).isEmpty());
        }

        @Test
        @DisplayName("short property stays in a long-stay market → extended-stay incentive")
        void extendedStay() {
            List<Recommendation> recs = scanner.scanAll(RUN_DATE, 0.6, 0.6, 350, 300, 21,
                MarketState.NEUTRAL, 2.4, 4.8);

            Recommendation r = only(recs, RecommendationType.EXTENDED_STAY_INCENTIVE);
            assertEquals("10% for 5+ nights", r.value());
            assertEquals(315, r.suggestedPrice(), EPS);
            assertEquals("Avg stay 2.4 nights vs market 4.8 nights.", r.rationale());
        }

        @Test
        @DisplayName("extended stay is skipped when either stay length is unknown")
        void extendedStayNeedsBoth() {
            assertTrue(scanner.scanAll(RUN_DATE, 0.6, 0.6, 350, 300, 21,
                MarketState.NEUTRAL, 2.4, null).isEmpty());
            assertTrue(scanner.scanAll(RUN_DATE, 0.6, 0.6, 350, 300, 21,
                MarketState.NEUTRAL, null, 4.8).isEmpty());
        }

        @Test
        @DisplayName("independent rules all fire together")
        void allRules() {
            List<Recommendation> recs = scanner.scanAll(RUN_DATE, 0.3, 0.7, 350, 300, 3,
                MarketState.NEUTRAL, 2.0, 5.0);
            assertEquals(3, recs.size());
        }
    }

    // ── evaluateLegacyVelocity() ───────────────────────────────────────

    @Nested
    @DisplayName("evaluateLegacyVelocity()")
    class LegacyTests {

        @Test
        @DisplayName("under 14 days → Last Minute Hero")
        void lastMinuteHero() {
            assertEquals(LegacyPromotion.LAST_MINUTE_HERO,
                scanner.evaluateLegacyVelocity(13, 0.5, 0.7, 350, 300));
        }

        @Test
        @DisplayName("14 to 60 days → Early Bird Velocity")
        void earlyBird() {
            assertEquals(LegacyPromotion.EARLY_BIRD_VELOCITY,
                scanner.evaluateLegacyVelocity(14, 0.5, 0.7, 350, 300));
            assertEquals(LegacyPromotion.EARLY_BIRD_VELOCITY,
                scanner.evaluateLegacyVelocity(60, 0.5, 0.7, 350, 300));
        }

        @Test
        @DisplayName("beyond 60 days or no velocity lag → NO_ACTION")
        void noAction() {
            assertEquals(LegacyPromotion.NO_ACTION, scanner.evaluateLegacyVelocity(61, 0.5, 0.7, 350, 300));
            assertEquals(LegacyPromotion.NO_ACTION, scanner.evaluateLegacyVelocity(10, 0.6, 0.65, 350, 300));
            assertEquals(LegacyPromotion.NO_ACTION, scanner.evaluateLegacyVelocity(10, 0.5, 0.7, 290, 300));
            assertEquals("NO_ACTION", LegacyPromotion.NO_ACTION.label());
        }
    }
}
