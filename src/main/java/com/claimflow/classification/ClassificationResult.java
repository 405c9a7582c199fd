package com.claimflow.classification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the classification collaborator.
 *
 * When {@code claimType} is absent the claim is unclassified: confidence is 0.0
 * and there is no priority. When present, a priority is always attached.
 */
public record ClassificationResult(
    @JsonProperty("claim_type") String claimType,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("priority") Priority priority
) {

    private static final ClassificationResult UNCLASSIFIED = new ClassificationResult(null, 0.0, null);

    public ClassificationResult {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        if (claimType == null) {
            if (confidence != 0.0 || priority != null) {
                throw new IllegalArgumentException("unclassified result must have zero confidence and no priority");
            }
        } else if (priority == null) {
            throw new IllegalArgumentException("priority is required for claim type " + claimType);
        }
    }

    public static ClassificationResult unclassified() {
        return UNCLASSIFIED;
    }

    @JsonIgnore
    public boolean isClassified() {
        return claimType != null && !claimType.isBlank();
    }
}
