package com.revenueplatform.marketdata.provider;

import com.revenueplatform.common.model.PropertySummary;
import com.revenueplatform.common.model.SourcedPropertyData;
import reactor.core.publisher.Mono;

import java.util.List;

public interface PropertyDataProvider {

    /** Never errors; falls back to fixed metrics with {@code live=false}. */
    Mono<SourcedPropertyData> getPropertyData(String propertyId);

    Mono<List<PropertySummary>> listProperties();
}
