package com.revenueplatform.marketdata.client;

import com.revenueplatform.common.model.PropertySummary;
import com.revenueplatform.common.model.SourcedPropertyData;
import com.revenueplatform.marketdata.provider.PropertyDataProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/property-data")
public class PropertyDataController {

    private final PropertyDataProvider service;

    public PropertyDataController(PropertyDataProvider service) {
        this.service = service;
    }

    @GetMapping("/{propertyId}")
    public Mono<ResponseEntity<SourcedPropertyData>> getPropertyData(@PathVariable String propertyId) {
        return service.getPropertyData(propertyId)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(ResponseEntity.internalServerError().build()));
    }

    @GetMapping
    public Mono<ResponseEntity<List<PropertySummary>>> listProperties() {
        return service.listProperties()
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(ResponseEntity.status(502).build()));
    }
}
