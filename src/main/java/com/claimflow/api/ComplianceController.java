package com.claimflow.api;

import com.claimflow.compliance.ComplianceEngine;
import com.claimflow.compliance.ComplianceResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * POST /v1/compliance/check
 *
 * Fields are optional on purpose: a missing one is a compliance outcome
 * ("missing required field"), not a bad request.
 */
@RestController
@RequestMapping("/v1/compliance")
public class ComplianceController {

    private final ComplianceEngine complianceEngine;

    public ComplianceController(ComplianceEngine complianceEngine) {
        this.complianceEngine = complianceEngine;
    }

    @PostMapping("/check")
    public ComplianceResult check(@RequestBody Map<String, Object> request) {
        return complianceEngine.checkCompliance(
            RequestFields.optionalString(request, "policy_number"),
            RequestFields.optionalString(request, "claim_type"),
            RequestFields.optionalString(request, "claim_text"));
    }
}
