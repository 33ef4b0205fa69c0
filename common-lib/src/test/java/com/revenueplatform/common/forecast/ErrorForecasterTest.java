package com.revenueplatform.common.forecast;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.model.AdjustmentType;
import com.revenueplatform.common.model.CorrectionResult;
import com.revenueplatform.common.model.Diagnosis;
import com.revenueplatform.common.model.DiagnosisType;
import com.revenueplatform.common.model.PerformanceMultipliers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorForecasterTest {

    private static final double EPS = 1e-6;

    private final ErrorForecaster forecaster = new ErrorForecaster(EngineSettings.defaults());

    // ── diagnose() ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("diagnose()")
    class DiagnoseTests {

        @Test
        @DisplayName("high occupancy, low RevPAR → CLASSIC_UNDERPRICING with 1/adr correction")
        void underpricing() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(1.8, 0.6, 0.4));
            assertEquals(DiagnosisType.CLASSIC_UNDERPRICING, d.type());
            assertEquals(0.4, d.priceErrorFactor(), EPS);
            assertEquals(2.5, d.correctionFactor(), EPS);
            assertTrue(d.explanation().startsWith("Bought occupancy (180% of market)"));
        }

        @Test
        @DisplayName("occupancy multiplier of exactly 1.5 still counts as underpricing")
        void underpricingBoundaryInclusive() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(1.5, 0.8, 0.5));
            assertEquals(DiagnosisType.CLASSIC_UNDERPRICING, d.type());
        }

        @Test
        @DisplayName("zero ADR multiplier falls back to a 2.0 correction")
        void underpricingZeroAdr() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(2.0, 0.5, 0.0));
            assertEquals(2.0, d.correctionFactor(), EPS);
        }

        @Test
        @DisplayName("low occupancy, low RevPAR → CLASSIC_OVERPRICING with 0.90 correction")
        void overpricing() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(0.5, 0.5, 1.0));
            assertEquals(DiagnosisType.CLASSIC_OVERPRICING, d.type());
            assertEquals(0.90, d.correctionFactor(), EPS);
        }

        @Test
        @DisplayName("anything else → ACCEPTABLE_PERFORMANCE")
        void acceptable() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(1.0, 1.0, 1.0));
            assertEquals(DiagnosisType.ACCEPTABLE_PERFORMANCE, d.type());
            assertEquals(1.0, d.correctionFactor(), EPS);
        }
    }

    // ── correct() ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("correct()")
    class CorrectTests {

        @Test
        @DisplayName("upward correction is halved")
        void smoothedUpward() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(1.8, 0.6, 0.8));
            CorrectionResult c = forecaster.correct(40000, d);
            assertEquals(1.125, c.appliedMultiplier(), EPS);
            assertEquals(45000, c.newTargetRent(), EPS);
            assertEquals(AdjustmentType.INCREASE, c.adjustmentType());
        }

        @Test
        @DisplayName("upward correction caps at +50%")
        void cappedUpward() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(2.0, 0.5, 0.2));
            CorrectionResult c = forecaster.correct(60000, d);
            assertEquals(1.5, c.appliedMultiplier(), EPS);
            assertEquals(90000, c.newTargetRent(), EPS);
        }

        @Test
        @DisplayName("overpricing applies 0.90 and reports the decrease")
        void downward() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(0.5, 0.5, 1.0));
            CorrectionResult c = forecaster.correct(50000, d);
            assertEquals(45000, c.newTargetRent(), EPS);
            assertEquals(-5000, c.adjustmentAmount(), EPS);
            assertEquals(-0.10, c.adjustmentPercentage(), EPS);
            assertEquals(AdjustmentType.DECREASE, c.adjustmentType());
        }

        @Test
        @DisplayName("acceptable performance leaves the target unchanged")
        void noChange() {
            Diagnosis d = forecaster.diagnose(new PerformanceMultipliers(1.0, 1.0, 1.0));
            CorrectionResult c = forecaster.correct(50000, d);
            assertEquals(50000, c.newTargetRent(), EPS);
            assertEquals(0.0, c.adjustmentAmount(), EPS);
            assertEquals(AdjustmentType.NO_CHANGE, c.adjustmentType());
        }
    }

    // ── review() ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("review(): full monthly pipeline")
    class ReviewTests {

        @Test
        @DisplayName("underpriced property: 90% vs 50% occupancy, RevPAR 80 vs 120")
        void underpricedProperty() {
            MonthlyReviewResult r = forecaster.review(0.9, 80, 0.5, 120, 60000, 1.0, 50000, 1.02);

            assertEquals(1.8, r.multipliers().occupancy(), EPS);
            assertEquals(80.0 / 120.0, r.multipliers().revPAR(), EPS);
            assertEquals((80 / 0.9) / 240.0, r.multipliers().adr(), EPS);
            assertEquals(DiagnosisType.CLASSIC_UNDERPRICING, r.diagnosis().type());
            assertEquals(1.5, r.correction().appliedMultiplier(), EPS);
            assertEquals(90000, r.correction().newTargetRent(), EPS);
            assertEquals(1.0, r.previousAps(), EPS);
            assertEquals(1.02, r.newAps(), EPS);
        }

        @Test
        @DisplayName("underpricing boundary: occupancy multiplier exactly 1.5, RevPAR exactly 0.8")
        void boundaryUnderpricing() {
            MonthlyReviewResult r = forecaster.review(0.75, 80, 0.5, 100, 10000, 1.0, 0, 1.0);

            assertEquals(DiagnosisType.CLASSIC_UNDERPRICING, r.diagnosis().type());
            assertEquals(1.4375, r.correction().appliedMultiplier(), EPS);
            assertEquals(14375, r.correction().newTargetRent(), EPS);
        }

        @Test
        @DisplayName("missing target rent bootstraps from market annual RevPAR × APS")
        void bootstrapsTarget() {
            MonthlyReviewResult r = forecaster.review(0.6, 100, 0.6, 100, 0, 1.2, 50000, 1.2);
            assertEquals(60000, r.correction().previousTargetRent(), EPS);
            assertEquals(60000, r.correction().newTargetRent(), EPS);
        }

        @Test
        @DisplayName("zero comp occupancy and RevPAR are floored, never divided by")
        void degenerateComps() {
            MonthlyReviewResult r = forecaster.review(0.5, 100, 0, 0, 1000, 1.0, 0, 1.0);
            assertTrue(Double.isFinite(r.multipliers().occupancy()));
            assertTrue(Double.isFinite(r.multipliers().revPAR()));
            assertTrue(Double.isFinite(r.multipliers().adr()));
            assertEquals(50.0, r.multipliers().occupancy(), EPS);
        }

        @Test
        @DisplayName("new target always equals previous × applied multiplier")
        void correctionInvariant() {
            double[][] cases = { {0.9, 80, 0.5, 120}, {0.3, 50, 0.6, 100}, {0.6, 100, 0.6, 100}, {0.2, 10, 0.9, 300} };
            for (double[] c : cases) {
                CorrectionResult r = forecaster.review(c[0], c[1], c[2], c[3], 42000, 1.0, 0, 1.0).correction();
                assertEquals(r.previousTargetRent() * r.appliedMultiplier(), r.newTargetRent(), EPS);
                assertTrue(r.appliedMultiplier() >= 0.80 && r.appliedMultiplier() <= 1.50);
            }
        }
    }

    @Test
    @DisplayName("deriveAdr() returns RevPAR itself when occupancy is zero")
    void deriveAdrZeroOccupancy() {
        assertEquals(100, ErrorForecaster.deriveAdr(100, 0), EPS);
        assertEquals(200, ErrorForecaster.deriveAdr(100, 0.5), EPS);
    }
}
