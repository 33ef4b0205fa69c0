package com.revenueplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Diagnosis(
    @JsonProperty("type")             DiagnosisType type,
    @JsonProperty("priceErrorFactor") double priceErrorFactor,
    @JsonProperty("correctionFactor") double correctionFactor,
    @JsonProperty("explanation")      String explanation
) {}
