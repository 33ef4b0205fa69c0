package com.revenueplatform.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Hospitable's {@code {"data": ...}} envelope. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HospitableResponse<T>(
    @JsonProperty("data") T data
) {}
