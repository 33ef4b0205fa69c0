package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Attribute set used to narrow the comparable market. Every field is optional;
 * the tier selector strips fields away as it relaxes.
 */
public record ComparableFilters(
    @JsonProperty("bedrooms")     Integer bedrooms,
    @JsonProperty("propertyType") String propertyType,
    @JsonProperty("minSleeps")    Integer minSleeps,
    @JsonProperty("amenities")    List<String> amenities,
    @JsonProperty("ota")          String ota
) {
    public ComparableFilters {
        amenities = amenities == null ? List.of() : List.copyOf(amenities);
    }

    public static ComparableFilters of(Integer bedrooms, String propertyType,
                                       Integer minSleeps, List<String> amenities) {
        return new ComparableFilters(bedrooms, propertyType, minSleeps, amenities, null);
    }

    /** Bedrooms + sleeps. */
    public ComparableFilters standard() {
        return new ComparableFilters(bedrooms, null, minSleeps, List.of(), ota);
    }

    /** Bedrooms only. */
    public ComparableFilters broad() {
        return new ComparableFilters(bedrooms, null, null, List.of(), ota);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return bedrooms == null && (propertyType == null || propertyType.isBlank())
            && minSleeps == null && amenities.isEmpty() && (ota == null || ota.isBlank());
    }
}
