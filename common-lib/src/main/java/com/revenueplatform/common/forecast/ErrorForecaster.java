package com.revenueplatform.common.forecast;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.model.AdjustmentType;
import com.revenueplatform.common.model.CorrectionResult;
import com.revenueplatform.common.model.Diagnosis;
import com.revenueplatform.common.model.DiagnosisType;
import com.revenueplatform.common.model.PerformanceMultipliers;

/**
 * Monthly strategic review: diagnoses systematic mispricing from
 * property-to-comp multipliers and corrects the annual target rent.
 *
 * <h3>Decision tree (first match wins)</h3>
 * <pre>
 * occupancy ≥ 1.5x AND revPAR ≤ 0.8x → CLASSIC_UNDERPRICING   (correction = 1 / adrMultiplier)
 * occupancy ≤ 0.7x AND revPAR ≤ 0.8x → CLASSIC_OVERPRICING    (correction = 0.90)
 * otherwise                          → ACCEPTABLE_PERFORMANCE (correction = 1.0)
 * </pre>
 *
 * <h3>Correction</h3>
 * Upward corrections are halved and capped at +50%, downward corrections floored at −20%.
 *
 * <p>Pure. Comp denominators are floored before every division, so degenerate
 * inputs yield extreme but defined ratios.
 */
public final class ErrorForecaster {

    private final EngineSettings.Monthly monthly;

    public ErrorForecaster(EngineSettings settings) {
        this.monthly = settings.monthly();
    }

    /**
     * ADR from RevPAR and occupancy. With zero occupancy the RevPAR itself is returned.
     */
    public static double deriveAdr(double revPAR, double occupancy) {
        if (occupancy <= 0) return revPAR;
        return revPAR / occupancy;
    }

    public PerformanceMultipliers multipliers(double ourOcc, double ourRevPAR, double ourAdr,
                                              double compOcc, double compRevPAR, double compAdr) {
        double safeCompOcc    = Math.max(compOcc,    monthly.minOccupancyThreshold());
        double safeCompRevPAR = Math.max(compRevPAR, monthly.minRevparThreshold());
        double safeCompAdr    = Math.max(compAdr,    monthly.minAdrThreshold());

        return new PerformanceMultipliers(
            ourOcc    / safeCompOcc,
            ourRevPAR / safeCompRevPAR,
            ourAdr    / safeCompAdr
        );
    }

    public Diagnosis diagnose(PerformanceMultipliers m) {
        if (m.occupancy() >= monthly.underpricingOccMultiplier()
                && m.revPAR() <= monthly.underpricingRevparMultiplier()) {
            double priceErrorFactor = m.adr();
            double correctionFactor = priceErrorFactor > 0
                ? 1 / priceErrorFactor
                : monthly.underpricingFallbackCorrection();
            return new Diagnosis(DiagnosisType.CLASSIC_UNDERPRICING, priceErrorFactor, correctionFactor,
                String.format("Bought occupancy (%.0f%% of market) with prices at only %.0f%% of market ADR.",
                    m.occupancy() * 100, priceErrorFactor * 100));
        }

        if (m.occupancy() <= monthly.overpricingOccMultiplier()
                && m.revPAR() <= monthly.overpricingRevparMultiplier()) {
            return new Diagnosis(DiagnosisType.CLASSIC_OVERPRICING, m.adr(),
                monthly.overpricingCorrectionFactor(),
                String.format("High prices deterred bookings. Only achieving %.0f%% of market occupancy.",
                    m.occupancy() * 100));
        }

        return new Diagnosis(DiagnosisType.ACCEPTABLE_PERFORMANCE, 1.0, 1.0,
            "Performance within acceptable bounds. No adjustment needed.");
    }

    public CorrectionResult correct(double currentTargetRent, Diagnosis diagnosis) {
        return switch (diagnosis.type()) {
            case CLASSIC_UNDERPRICING -> {
                double smoothed = 1 + (diagnosis.correctionFactor() - 1) / monthly.correctionSmoothingDivisor();
                yield CorrectionResult.of(currentTargetRent,
                    Math.min(smoothed, monthly.maxUpwardCorrection()), AdjustmentType.INCREASE);
            }
            case CLASSIC_OVERPRICING -> CorrectionResult.of(currentTargetRent,
                Math.max(diagnosis.correctionFactor(), monthly.maxDownwardCorrection()), AdjustmentType.DECREASE);
            case ACCEPTABLE_PERFORMANCE -> CorrectionResult.of(currentTargetRent, 1.0, AdjustmentType.NO_CHANGE);
        };
    }

    /**
     * Full monthly pipeline. When no target rent exists yet ({@code currentTargetRent <= 0})
     * it is bootstrapped as {@code marketAnnualRevPAR * currentAps}.
     *
     * @param newAps carried through to the result for reporting only
     */
    public MonthlyReviewResult review(double ourOcc, double ourRevPAR,
                                      double compOcc, double compRevPAR,
                                      double currentTargetRent, double currentAps,
                                      double marketAnnualRevPAR, double newAps) {
        double ourAdr  = deriveAdr(ourRevPAR, ourOcc);
        double compAdr = deriveAdr(compRevPAR, compOcc);

        PerformanceMultipliers metrics = multipliers(ourOcc, ourRevPAR, ourAdr, compOcc, compRevPAR, compAdr);
        Diagnosis diagnosis = diagnose(metrics);

        double effectiveTarget = currentTargetRent > 0
            ? currentTargetRent
            : marketAnnualRevPAR * currentAps;

        return new MonthlyReviewResult(metrics, diagnosis, correct(effectiveTarget, diagnosis),
            currentAps, newAps);
    }
}
