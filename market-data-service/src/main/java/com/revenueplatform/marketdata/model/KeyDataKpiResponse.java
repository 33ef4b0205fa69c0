package com.revenueplatform.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Body of Key Data's {@code /ota/market/kpis/month} and {@code /week} responses. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyDataKpiResponse(
    @JsonProperty("data") Data data
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
        @JsonProperty("kpis") List<Kpi> kpis
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Kpi(
        @JsonProperty("guest_occupancy")  Double guestOccupancy,
        @JsonProperty("adr")              Double adr,
        @JsonProperty("revpar")           Double revpar,
        @JsonProperty("guest_nights")     Double guestNights,
        @JsonProperty("available_nights") Double availableNights
    ) {}

    public List<Kpi> kpisOrEmpty() {
        if (data == null || data.kpis() == null) return List.of();
        return data.kpis();
    }
}
