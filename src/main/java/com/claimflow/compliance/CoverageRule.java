package com.claimflow.compliance;

import com.claimflow.policy.Policy;
import com.claimflow.policy.PolicyStore;

/**
 * Policy: the classified claim type must be one the policy covers.
 * Matching is exact, labels are compared as produced by the classifier.
 */
public class CoverageRule implements ComplianceRule {

    private final PolicyStore policyStore;

    public CoverageRule(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @Override
    public String ruleId() {
        return "policy-coverage";
    }

    @Override
    public RuleResult evaluate(ComplianceRequest request) {
        Policy policy = policyStore.findById(request.policyNumber())
            .orElseThrow(() -> new IllegalStateException("policy vanished: " + request.policyNumber()));

        if (!policy.covers(request.claimType())) {
            return new RuleResult.Violation("claim type '" + request.claimType() + "' is not covered");
        }
        return RuleResult.pass();
    }
}
