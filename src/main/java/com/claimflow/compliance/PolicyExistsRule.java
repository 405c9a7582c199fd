package com.claimflow.compliance;

import com.claimflow.policy.PolicyStore;

public class PolicyExistsRule implements ComplianceRule {

    private final PolicyStore policyStore;

    public PolicyExistsRule(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @Override
    public String ruleId() {
        return "policy-exists";
    }

    @Override
    public RuleResult evaluate(ComplianceRequest request) {
        if (policyStore.findById(request.policyNumber()).isEmpty()) {
            return new RuleResult.Violation("policy not found: " + request.policyNumber());
        }
        return RuleResult.pass();
    }
}
