package com.revenueplatform.orchestrator.adapter;

import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.PropertySummary;
import com.revenueplatform.common.model.SourcedMarketSelection;
import com.revenueplatform.common.model.SourcedPropertyData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Reads comparable market and property data from market-data-service.
 *
 * <p>market-data-service already substitutes fallback data for upstream outages, so
 * errors seen here mean the service itself is unreachable; they propagate.
 */
@Component
public class MarketDataAdapter {

    private static final Logger log = LoggerFactory.getLogger(MarketDataAdapter.class);

    private final WebClient marketDataClient;

    public MarketDataAdapter(WebClient marketDataClient) {
        this.marketDataClient = marketDataClient;
    }

    public Mono<SourcedMarketSelection> fetchComparables(String marketId, ComparableFilters filters,
                                                         String traceId) {
        return marketDataClient.get()
            .uri(b -> comparablesUri(b, marketId, filters))
            .header("X-Trace-Id", traceId)
            .retrieve()
            .bodyToMono(SourcedMarketSelection.class)
            .doOnNext(s -> log.debug("Comparables fetched. marketId={} live={} traceId={}",
                marketId, s.live(), traceId));
    }

    public Mono<SourcedPropertyData> fetchPropertyData(String propertyId, String traceId) {
        return marketDataClient.get()
            .uri("/api/v1/property-data/{propertyId}", propertyId)
            .header("X-Trace-Id", traceId)
            .retrieve()
            .bodyToMono(SourcedPropertyData.class)
            .doOnNext(p -> log.debug("Property data fetched. propertyId={} live={} traceId={}",
                propertyId, p.live(), traceId));
    }

    public Mono<List<PropertySummary>> listProperties(String traceId) {
        return marketDataClient.get()
            .uri("/api/v1/property-data")
            .header("X-Trace-Id", traceId)
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<List<PropertySummary>>() {})
            .defaultIfEmpty(List.of());
    }

    private static URI comparablesUri(UriBuilder b, String marketId, ComparableFilters filters) {
        b.path("/api/v1/market-data/comparables/{marketId}");
        if (filters != null) {
            if (filters.bedrooms() != null)     b.queryParam("bedrooms", filters.bedrooms());
            if (filters.propertyType() != null) b.queryParam("propertyType", filters.propertyType());
            if (filters.minSleeps() != null)    b.queryParam("minSleeps", filters.minSleeps());
            if (!filters.amenities().isEmpty()) b.queryParam("amenities", filters.amenities().toArray());
        }
        return b.build(marketId);
    }
}
