package com.revenueplatform.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HospitableReservation(
    @JsonProperty("property_id")   String propertyId,
    @JsonProperty("property_uuid") String propertyUuid,
    @JsonProperty("check_in")      String checkIn,
    @JsonProperty("checkin")       String checkin,
    @JsonProperty("check_out")     String checkOut,
    @JsonProperty("checkout")      String checkout,
    @JsonProperty("status")        String status,
    @JsonProperty("nights")        Integer nights
) {
    public boolean belongsTo(String property) {
        return property.equals(propertyId) || property.equals(propertyUuid);
    }

    public boolean isCancelled() {
        return "cancelled".equals(status) || "declined".equals(status);
    }

    public String arrival() {
        return checkIn != null ? checkIn : checkin;
    }

    public String departure() {
        return checkOut != null ? checkOut : checkout;
    }
}
