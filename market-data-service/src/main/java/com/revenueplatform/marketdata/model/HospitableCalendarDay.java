package com.revenueplatform.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One calendar night. An unavailable night with a reservation attached is booked;
 * unavailable without one is owner-blocked.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HospitableCalendarDay(
    @JsonProperty("date")           String date,
    @JsonProperty("available")      Boolean available,
    @JsonProperty("price")          Double price,
    @JsonProperty("nightly_price")  Double nightlyPrice,
    @JsonProperty("reservation")    JsonNode reservation,
    @JsonProperty("reservation_id") String reservationId
) {
    public boolean isUnavailable() {
        return Boolean.FALSE.equals(available);
    }

    public boolean hasReservation() {
        boolean attached = reservation != null && !reservation.isNull() && !reservation.isMissingNode();
        return attached || (reservationId != null && !reservationId.isBlank());
    }

    /** Take-home price for the night, after platform fees. */
    public double nightlyAmount() {
        if (price != null) return price;
        return nightlyPrice != null ? nightlyPrice : 0;
    }
}
