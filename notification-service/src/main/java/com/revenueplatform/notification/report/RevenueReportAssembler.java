package com.revenueplatform.notification.report;

import com.revenueplatform.common.bellcurve.WeeklyReviewResult;
import com.revenueplatform.common.engine.EngineResult;
import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.common.forecast.MonthlyReviewResult;
import com.revenueplatform.common.formula.CoreMetrics;
import com.revenueplatform.common.model.ComparableSelection;
import com.revenueplatform.common.model.CorrectionResult;
import com.revenueplatform.common.model.Recommendation;
import com.revenueplatform.common.model.ReviewType;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders a {@link RevenueReportEvent} as plain text for chat delivery.
 *
 * <pre>
 *   header          review type, property, tier and comp count, data source
 *   SECTION A       core engine metrics
 *   SECTION B       error forecasting (monthly review)
 *   SECTION C       bell curve decision tree with day-by-day table
 *   SECTION D       supplemental promotions and the legacy velocity check
 *   --- SUMMARY ---
 * </pre>
 *
 * Money renders as {@code $1,234.56}, percentages with one decimal.
 */
@Component
public class RevenueReportAssembler {

    public static final String SUMMARY_MARKER = "--- SUMMARY ---";

    private static final int LABEL_WIDTH = 44;
    private static final String RULE      = "=".repeat(72);
    private static final String THIN_RULE = "-".repeat(70);

    public String assemble(RevenueReportEvent event) {
        EngineResult result = event.result();
        StringBuilder sb = new StringBuilder();
        header(sb, event);
        coreEngine(sb, result.core());
        errorForecasting(sb, result.monthlyReview());
        bellCurve(sb, result.weeklyReview());
        promotions(sb, result);
        summary(sb, result);
        return sb.toString();
    }

    /** Header line plus the summary block only. */
    public String summary(RevenueReportEvent event) {
        String full = assemble(event);
        String headerLine = full.substring(0, full.indexOf('\n'));
        return headerLine + "\n\n" + full.substring(full.indexOf(SUMMARY_MARKER));
    }

    // ── sections ──────────────────────────────────────────────────────────────

    private void header(StringBuilder sb, RevenueReportEvent event) {
        ReviewType type = event.reviewType() != null ? event.reviewType() : ReviewType.ON_DEMAND;
        ComparableSelection selection = event.selection();
        sb.append(String.format("%s | property=%s market=%s\n", type.title(), event.propertyId(), event.marketId()));
        sb.append(RULE).append('\n');
        if (selection != null) {
            sb.append(row("Comparable Tier", selection.tier().label() + " (" + selection.dataPoints() + " comps)"));
        }
        sb.append(row("Data Source", event.marketLive() && event.propertyLive() ? "LIVE" : "FALLBACK"));
        sb.append(row("Run Date", String.valueOf(event.result().runDate())));
        sb.append(row("Trace Id", event.traceId()));
    }

    private void coreEngine(StringBuilder sb, CoreMetrics core) {
        section(sb, "SECTION A: CORE ENGINE");
        sb.append(row("Performance Index", fx(core.performanceIndex(), 3)));
        sb.append(row("New APS", fx(core.newAps(), 3)));
        sb.append(row("Annual Revenue Target", money(core.annualTarget())));
        sb.append(row("Min Nightly Price", money(core.minPrice())));
        sb.append(row("Max Nightly Price", money(core.maxPrice())));
        sb.append(row("Dynamic Centroid", money(core.dynamicCentroid())));
        sb.append(row("Base Price (ADR x APS)", money(core.basePrice())));
    }

    private void errorForecasting(StringBuilder sb, MonthlyReviewResult monthly) {
        section(sb, "SECTION B: ERROR FORECASTING (Monthly Strategic Review)");
        sb.append("  Performance Multipliers:\n");
        sb.append(row("  Occupancy Multiplier", fx(monthly.multipliers().occupancy(), 2) + "x"));
        sb.append(row("  RevPAR Multiplier", fx(monthly.multipliers().revPAR(), 2) + "x"));
        sb.append(row("  ADR Multiplier", fx(monthly.multipliers().adr(), 2) + "x"));
        sb.append('\n');
        sb.append(row("Diagnosis", monthly.diagnosis().type().name()));
        sb.append(row("Explanation", monthly.diagnosis().explanation()));
        sb.append('\n');
        CorrectionResult c = monthly.correction();
        sb.append(row("Correction Action", c.adjustmentType().name()));
        sb.append(row("Previous Target Rent", money(c.previousTargetRent())));
        sb.append(row("New Target Rent", money(c.newTargetRent())));
        sb.append(row("Applied Multiplier", fx(c.appliedMultiplier(), 2) + "x"));
        sb.append(row("Adjustment", money(c.adjustmentAmount())
            + " (" + (c.adjustmentPercentage() >= 0 ? "+" : "") + pct(c.adjustmentPercentage()) + ")"));
    }

    private void bellCurve(StringBuilder sb, WeeklyReviewResult weekly) {
        section(sb, "SECTION C: BELL CURVE DECISION TREE (Weekly Tactical Scan)");
        sb.append(row("Market State", weekly.marketState().name()));
        sb.append(row("Operating Mode", weekly.operatingMode().displayName()));
        sb.append(row("Transition Point", fx(weekly.bellCurve().transitionPoint(), 0) + " days"));
        sb.append(row("Back Half Days Analyzed", String.valueOf(weekly.bellCurve().backHalfDays())));
        sb.append(row("Front Half Days Analyzed", String.valueOf(weekly.bellCurve().frontHalfDays())));
        sb.append('\n');
        sb.append(row("Total Recommendations", String.valueOf(weekly.counts().total())));
        sb.append(row("  Rate Increases", String.valueOf(weekly.counts().rateIncreases())));
        sb.append(row("  Price Drops", String.valueOf(weekly.counts().priceDrops())));
        sb.append(row("  Promotions", String.valueOf(weekly.counts().promotions())));

        if (weekly.recommendations().isEmpty()) return;
        sb.append('\n');
        sb.append("  ").append(THIN_RULE).append('\n');
        sb.append("  Day-by-Day Recommendations:\n");
        sb.append("  ").append(THIN_RULE).append('\n');
        sb.append(String.format("  %-12s %-20s %-12s %-10s %-10s Phase\n",
                                "Date", "Type", "Value", "Current", "Suggest"));
        sb.append("  ").append(THIN_RULE).append('\n');
        for (Recommendation r : weekly.recommendations()) {
            sb.append(String.format("  %-12s %-20s %-12s %-10s %-10s %s\n",
                r.date(), r.type(), r.value(), money(r.currentPrice()), money(r.suggestedPrice()), r.phase()));
        }
    }

    private void promotions(StringBuilder sb, EngineResult result) {
        section(sb, "SECTION D: SUPPLEMENTAL PROMOTION SCAN");
        sb.append(row("Legacy Velocity Check", result.legacyPromotion().label()));
        if (result.promotions().isEmpty()) {
            sb.append(row("Structured Promotions", "None triggered"));
            return;
        }
        sb.append('\n');
        sb.append("  Structured Promotions Found:\n");
        sb.append("  ").append(THIN_RULE).append('\n');
        for (Recommendation r : result.promotions()) {
            sb.append(String.format("    %-26s %-20s %s\n", r.type(), r.value(), r.rationale()));
        }
    }

    private void summary(StringBuilder sb, EngineResult result) {
        sb.append('\n').append(SUMMARY_MARKER).append('\n');
        CoreMetrics core = result.core();
        sb.append(row("New APS", fx(core.newAps(), 3)));
        sb.append(row("Annual Target", money(core.annualTarget())));
        sb.append(row("Price Range", money(core.minPrice()) + " - " + money(core.maxPrice())));
        sb.append(row("Error Forecast Diagnosis", result.monthlyReview().diagnosis().type().name()));
        sb.append(row("Corrected Target Rent", money(result.monthlyReview().correction().newTargetRent())));
        sb.append(row("Market State", result.weeklyReview().marketState() + " -> "
                                      + result.weeklyReview().operatingMode().displayName()));
        sb.append(row("Bell Curve Recommendations", String.valueOf(result.weeklyReview().counts().total())));
        sb.append(row("Promotions Triggered", String.valueOf(result.promotions().size())));
    }

    // ── formatting ────────────────────────────────────────────────────────────

    private static void section(StringBuilder sb, String title) {
        sb.append('\n').append(RULE).append('\n');
        sb.append("  ").append(title).append('\n');
        sb.append(RULE).append('\n');
    }

    static String row(String label, String value) {
        return "  " + label + " ".repeat(Math.max(1, LABEL_WIDTH - label.length())) + value + "\n";
    }

    static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    static String pct(double ratio) {
        return String.format(Locale.US, "%.1f%%", ratio * 100);
    }

    private static String fx(double value, int decimals) {
        return String.format(Locale.US, "%." + decimals + "f", value);
    }
}
