package com.revenueplatform.marketdata.service;

import com.revenueplatform.common.comparable.ComparableFilterSelector;
import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.SourcedMarketSelection;
import com.revenueplatform.marketdata.client.KeyDataWebClient;
import com.revenueplatform.marketdata.provider.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Comparable market data with tiered fallback.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Key Data not configured → fallback selection, no API call.</li>
 *   <li>Otherwise walk the tiers via {@link ComparableFilterSelector}, one Key Data
 *       sample per tier.</li>
 *   <li>Any upstream error → fallback selection, logged at WARN.</li>
 * </ol>
 */
@Service
public class ComparableMarketService implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(ComparableMarketService.class);

    private final KeyDataWebClient client;
    private final ComparableFilterSelector selector;

    public ComparableMarketService(KeyDataWebClient client, ComparableFilterSelector selector) {
        this.client   = client;
        this.selector = selector;
    }

    @Override
    public Mono<SourcedMarketSelection> getComparables(String marketId, ComparableFilters filters) {
        if (!client.isConfigured()) {
            log.warn("MARKET_FALLBACK marketId={} reason=key-data-not-configured", marketId);
            return Mono.just(fallback());
        }

        return Mono.defer(() -> selector.select(filters, f -> client.fetchMarketSample(marketId, f)))
            .map(selection -> new SourcedMarketSelection(selection, true))
            .onErrorResume(e -> {
                log.warn("MARKET_FALLBACK marketId={} reason={}", marketId, e.getMessage());
                return Mono.just(fallback());
            });
    }

    private static SourcedMarketSelection fallback() {
        return new SourcedMarketSelection(FallbackData.marketSelection(), false);
    }
}
