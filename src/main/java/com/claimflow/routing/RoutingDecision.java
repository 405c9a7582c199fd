package com.claimflow.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record RoutingDecision(
    @JsonProperty("decision") Decision decision,
    @JsonProperty("reason") String reason
) {

    public RoutingDecision {
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(reason, "reason is required");
    }

    @JsonProperty("label")
    public String label() {
        return decision.getLabel();
    }
}
