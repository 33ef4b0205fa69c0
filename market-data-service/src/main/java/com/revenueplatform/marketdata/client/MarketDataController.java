package com.revenueplatform.marketdata.client;

import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.SourcedMarketSelection;
import com.revenueplatform.marketdata.provider.MarketDataProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private final MarketDataProvider service;

    public MarketDataController(MarketDataProvider service) {
        this.service = service;
    }

    @GetMapping("/comparables/{marketId}")
    public Mono<ResponseEntity<SourcedMarketSelection>> getComparables(
            @PathVariable String marketId,
            @RequestParam(required = false) Integer bedrooms,
            @RequestParam(required = false) String propertyType,
            @RequestParam(required = false) Integer minSleeps,
            @RequestParam(required = false) List<String> amenities) {
        ComparableFilters filters = ComparableFilters.of(bedrooms, propertyType, minSleeps, amenities);
        return service.getComparables(marketId, filters.isEmpty() ? null : filters)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(ResponseEntity.internalServerError().build()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
