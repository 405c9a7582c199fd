package com.claimflow.compliance;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Outcome of a compliance check. The reason is always populated.
 *
 * @param ruleId the rule that decided the outcome
 */
public record ComplianceResult(
    @JsonProperty("compliant") boolean compliant,
    @JsonProperty("reason") String reason,
    @JsonProperty("rule_id") String ruleId
) {

    public static final String COMPLIANT_REASON = "compliant";

    public ComplianceResult {
        Objects.requireNonNull(reason, "reason is required");
    }

    public static ComplianceResult passed() {
        return new ComplianceResult(true, COMPLIANT_REASON, "all-rules-passed");
    }

    public static ComplianceResult violation(String ruleId, String reason) {
        return new ComplianceResult(false, reason, ruleId);
    }
}
