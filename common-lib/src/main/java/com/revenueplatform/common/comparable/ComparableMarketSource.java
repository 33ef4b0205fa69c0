package com.revenueplatform.common.comparable;

import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.MarketSample;
import reactor.core.publisher.Mono;

/**
 * Data source consulted once per comparable tier.
 *
 * <p>A {@code null} filter set means the whole market. Implementations report
 * upstream failures as error signals; the selector does not retry them.
 */
@FunctionalInterface
public interface ComparableMarketSource {
    Mono<MarketSample> fetch(ComparableFilters filters);
}
