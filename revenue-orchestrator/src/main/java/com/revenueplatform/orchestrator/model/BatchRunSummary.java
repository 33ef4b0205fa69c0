package com.revenueplatform.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Outcome of a run over every listed property. */
public record BatchRunSummary(
    @JsonProperty("total")             int total,
    @JsonProperty("succeeded")         int succeeded,
    @JsonProperty("failed")            int failed,
    @JsonProperty("failedPropertyIds") List<String> failedPropertyIds
) {
    public record Outcome(String propertyId, boolean success) {}

    public static BatchRunSummary of(List<Outcome> outcomes) {
        List<String> failedIds = outcomes.stream()
            .filter(o -> !o.success())
            .map(Outcome::propertyId)
            .toList();
        return new BatchRunSummary(outcomes.size(), outcomes.size() - failedIds.size(),
            failedIds.size(), failedIds);
    }
}
