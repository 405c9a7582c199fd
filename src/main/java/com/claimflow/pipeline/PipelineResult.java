package com.claimflow.pipeline;

import com.claimflow.classification.ClassificationResult;
import com.claimflow.classification.Priority;
import com.claimflow.compliance.ComplianceResult;
import com.claimflow.extraction.ExtractedEntities;
import com.claimflow.routing.RoutingDecision;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Locale;

/**
 * Result of one pipeline run, as handed to the presentation layer.
 *
 * A completed run carries every stage's output; a failed run carries only the
 * status and a human-readable reason.
 */
public sealed interface PipelineResult {

    String STATUS_SUCCESS = "Success";
    String STATUS_FAILED = "Failed";

    @JsonProperty("status")
    String status();

    @JsonPropertyOrder({"status", "extracted_data", "classification", "compliance", "final_routing"})
    record Completed(
        @JsonProperty("extracted_data") ExtractedEntities extractedData,
        @JsonProperty("classification") ClassificationSummary classification,
        @JsonProperty("compliance") ComplianceResult compliance,
        @JsonProperty("final_routing") RoutingDecision finalRouting
    ) implements PipelineResult {

        @Override
        @JsonProperty("status")
        public String status() {
            return STATUS_SUCCESS;
        }
    }

    @JsonPropertyOrder({"status", "reason"})
    record Failed(
        @JsonIgnore PipelineState failedAt,
        @JsonProperty("reason") String reason
    ) implements PipelineResult {

        @Override
        @JsonProperty("status")
        public String status() {
            return STATUS_FAILED;
        }
    }

    /**
     * Classification as presented: confidence is rendered with two decimals.
     */
    record ClassificationSummary(
        @JsonProperty("type") String type,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("confidence") String confidence
    ) {

        static ClassificationSummary of(ClassificationResult result) {
            return new ClassificationSummary(
                result.claimType(),
                result.priority(),
                String.format(Locale.ROOT, "%.2f", result.confidence())
            );
        }
    }
}
