package com.revenueplatform.marketdata.provider;

import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.SourcedMarketSelection;
import reactor.core.publisher.Mono;

/**
 * Comparable market source. Implementations never error: an upstream failure yields
 * the fallback selection with {@code live=false}.
 */
public interface MarketDataProvider {
    Mono<SourcedMarketSelection> getComparables(String marketId, ComparableFilters filters);
}
