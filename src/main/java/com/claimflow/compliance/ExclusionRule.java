package com.claimflow.compliance;

import com.claimflow.policy.Policy;
import com.claimflow.policy.PolicyStore;

import java.util.Locale;

/**
 * Policy: the claim text must not contain any of the policy's exclusion phrases.
 *
 * Exclusions are checked in their configured order and matched as plain
 * case-insensitive substrings, so "war" also matches inside "warranty".
 * The first phrase found is reported.
 */
public class ExclusionRule implements ComplianceRule {

    private final PolicyStore policyStore;

    public ExclusionRule(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @Override
    public String ruleId() {
        return "policy-exclusions";
    }

    @Override
    public RuleResult evaluate(ComplianceRequest request) {
        Policy policy = policyStore.findById(request.policyNumber())
            .orElseThrow(() -> new IllegalStateException("policy vanished: " + request.policyNumber()));

        String text = request.claimText().toLowerCase(Locale.ROOT);
        for (String exclusion : policy.exclusions()) {
            if (text.contains(exclusion)) {
                return new RuleResult.Violation("claim rejected due to exclusion clause: '" + exclusion + "'");
            }
        }
        return RuleResult.pass();
    }
}
