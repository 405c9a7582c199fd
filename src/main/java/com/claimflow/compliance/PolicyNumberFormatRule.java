package com.claimflow.compliance;

import com.claimflow.policy.Policy;

/**
 * Rejects policy numbers that are not of the form {@code PN-<LETTERS>-<DIGITS>}.
 * The whole value must match; trailing characters are a format error.
 */
public class PolicyNumberFormatRule implements ComplianceRule {

    @Override
    public String ruleId() {
        return "policy-number-format";
    }

    @Override
    public RuleResult evaluate(ComplianceRequest request) {
        if (!Policy.ID_FORMAT.matcher(request.policyNumber()).matches()) {
            return new RuleResult.Violation("invalid policy number format: " + request.policyNumber());
        }
        return RuleResult.pass();
    }
}
