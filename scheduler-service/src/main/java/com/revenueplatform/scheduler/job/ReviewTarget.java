package com.revenueplatform.scheduler.job;

import com.revenueplatform.common.model.ComparableFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * A property reviewed on schedule, parsed from {@code scheduler.targets}:
 * comma-separated {@code propertyId:marketId[:bedrooms]} entries.
 */
public record ReviewTarget(String propertyId, String marketId, Integer bedrooms) {

    private static final Logger log = LoggerFactory.getLogger(ReviewTarget.class);

    /** {@code null} when no bedroom count was given, so the market-data side uses the whole market. */
    public ComparableFilters filters() {
        return bedrooms == null ? null : ComparableFilters.of(bedrooms, null, null, List.of());
    }

    /** Blank and malformed entries are skipped with a warning. */
    public static List<ReviewTarget> parseAll(String config) {
        if (config == null || config.isBlank()) return List.of();

        List<ReviewTarget> targets = new ArrayList<>();
        for (String raw : config.split(",")) {
            String entry = raw.trim();
            if (entry.isEmpty()) continue;

            String[] parts = entry.split(":");
            if (parts.length < 2 || parts.length > 3 || parts[0].isBlank() || parts[1].isBlank()) {
                log.warn("Skipping malformed review target '{}'. expected=propertyId:marketId[:bedrooms]", entry);
                continue;
            }
            Integer bedrooms = null;
            if (parts.length == 3) {
                try {
                    bedrooms = Integer.valueOf(parts[2].trim());
                } catch (NumberFormatException e) {
                    log.warn("Skipping review target '{}' with non-numeric bedrooms", entry);
                    continue;
                }
            }
            targets.add(new ReviewTarget(parts[0].trim(), parts[1].trim(), bedrooms));
        }
        return List.copyOf(targets);
    }
}
