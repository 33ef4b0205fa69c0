package com.revenueplatform.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A Hospitable listing. Older accounts expose {@code id}/{@code price} instead of {@code uuid}/{@code base_price}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HospitableProperty(
    @JsonProperty("uuid")       String uuid,
    @JsonProperty("id")         String id,
    @JsonProperty("name")       String name,
    @JsonProperty("base_price") Double basePrice,
    @JsonProperty("price")      Double price,
    @JsonProperty("status")     String status
) {
    public String effectiveId() {
        return uuid != null ? uuid : (id != null ? id : "");
    }

    public double effectivePrice() {
        if (basePrice != null) return basePrice;
        return price != null ? price : 0;
    }

    public boolean isActive() {
        return status == null || status.isBlank() || "active".equals(status);
    }
}
