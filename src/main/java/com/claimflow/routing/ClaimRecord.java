package com.claimflow.routing;

import com.claimflow.classification.ClassificationResult;
import com.claimflow.compliance.ComplianceResult;
import com.claimflow.extraction.ExtractedEntities;

/**
 * Everything the routing rules look at for one claim. Built by the pipeline
 * for a single run and never shared between runs.
 */
public record ClaimRecord(
    ExtractedEntities entities,
    ClassificationResult classification,
    ComplianceResult compliance
) {

    public Double claimValue() {
        return entities != null ? entities.claimValue() : null;
    }
}
