package com.claimflow.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The claims configuration document, bound as-is from JSON.
 *
 * Holds the policy database, the classification confidence threshold,
 * the routing value thresholds and the classifier training samples.
 * Instances handed out by {@link ClaimsConfigLoader} are validated and immutable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaimsConfig(
    @JsonProperty("policy_db") Map<String, PolicyDefinition> policyDb,
    @JsonProperty("confidence_threshold") Double confidenceThreshold,
    @JsonProperty("routing_rules") RoutingRules routingRules,
    @JsonProperty("training_data") List<TrainingSample> trainingData
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PolicyDefinition(
        @JsonProperty("coverage") List<String> coverage,
        @JsonProperty("exclusions") List<String> exclusions
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RoutingRules(
        @JsonProperty("high_value_threshold") Double highValueThreshold,
        @JsonProperty("stp_threshold") Double stpThreshold
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrainingSample(
        @JsonProperty("description") String description,
        @JsonProperty("claim_type") String claimType
    ) {}
}
