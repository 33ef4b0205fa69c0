package com.revenueplatform.marketdata.service;

import com.revenueplatform.common.model.PropertySummary;
import com.revenueplatform.common.model.SourcedPropertyData;
import com.revenueplatform.marketdata.client.HospitableWebClient;
import com.revenueplatform.marketdata.provider.PropertyDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
public class PropertyDataService implements PropertyDataProvider {

    private static final Logger log = LoggerFactory.getLogger(PropertyDataService.class);

    private final HospitableWebClient client;

    public PropertyDataService(HospitableWebClient client) {
        this.client = client;
    }

    @Override
    public Mono<SourcedPropertyData> getPropertyData(String propertyId) {
        if (!client.isConfigured()) {
            log.warn("PROPERTY_FALLBACK propertyId={} reason=hospitable-not-configured", propertyId);
            return Mono.just(new SourcedPropertyData(FallbackData.PROPERTY, false));
        }

        return client.fetchPropertyData(propertyId)
            .map(data -> new SourcedPropertyData(data, true))
            .onErrorResume(e -> {
                log.warn("PROPERTY_FALLBACK propertyId={} reason={}", propertyId, e.getMessage());
                return Mono.just(new SourcedPropertyData(FallbackData.PROPERTY, false));
            });
    }

    /** Empty when Hospitable is not configured; errors propagate. */
    @Override
    public Mono<List<PropertySummary>> listProperties() {
        if (!client.isConfigured()) {
            log.warn("Property listing skipped. reason=hospitable-not-configured");
            return Mono.just(List.of());
        }
        return client.listProperties();
    }
}
