package com.revenueplatform.common.comparable;

import com.revenueplatform.common.config.EngineSettings;
import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.ComparableSelection;
import com.revenueplatform.common.model.ComparableTier;
import com.revenueplatform.common.model.MarketSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Tiered fallback that picks the strictest comparable set with enough comps.
 *
 * <p>Tiers are tried in {@link ComparableTier} declaration order:
 * <pre>
 *   STRICT → STANDARD → BROAD → WHOLE_MARKET
 * </pre>
 * The first tier whose sample reaches {@code minComps} wins. WHOLE_MARKET is accepted
 * whatever its sample size. Each fetch completes before the next tier is considered;
 * a tier is never skipped and never retried. Every relaxation is logged.
 *
 * <p>Without filters there is nothing to relax: a single whole-market fetch is made.
 */
public final class ComparableFilterSelector {

    private static final Logger log = LoggerFactory.getLogger(ComparableFilterSelector.class);

    private static final List<ComparableTier> TIERS = List.of(ComparableTier.values());

    private final int minComps;

    public ComparableFilterSelector(EngineSettings settings) {
        this.minComps = settings.minComps();
    }

    /**
     * @param filters full filter set derived from the property; {@code null} or empty
     *                means one whole-market fetch
     * @param source  per-tier market data fetch
     * @return the accepted tier with its market data and sample count
     */
    public Mono<ComparableSelection> select(ComparableFilters filters, ComparableMarketSource source) {
        if (filters == null || filters.isEmpty()) {
            log.info("[CompSet] no filters, using tier={}", ComparableTier.WHOLE_MARKET);
            return selectFrom(TIERS.indexOf(ComparableTier.WHOLE_MARKET), null, source);
        }
        return selectFrom(0, filters, source);
    }

    private Mono<ComparableSelection> selectFrom(int index, ComparableFilters filters,
                                                 ComparableMarketSource source) {
        ComparableTier tier = TIERS.get(index);
        ComparableFilters applied = tier.narrow(filters);

        return source.fetch(applied).flatMap(sample -> {
            boolean lastTier = index == TIERS.size() - 1;
            if (sample.dataPoints() >= minComps || lastTier) {
                log.info("[CompSet] tier={} accepted. dataPoints={} minComps={}",
                         tier, sample.dataPoints(), minComps);
                return Mono.just(toSelection(tier, applied, sample));
            }
            ComparableTier next = TIERS.get(index + 1);
            log.info("[CompSet] tier={} too thin (dataPoints={} < {}), relaxing to {}",
                     tier, sample.dataPoints(), minComps, next);
            return selectFrom(index + 1, filters, source);
        });
    }

    private static ComparableSelection toSelection(ComparableTier tier, ComparableFilters applied,
                                                   MarketSample sample) {
        return new ComparableSelection(tier, applied, sample.marketData(), sample.dataPoints());
    }
}
