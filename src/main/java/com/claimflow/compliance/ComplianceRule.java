package com.claimflow.compliance;

/**
 * A single compliance rule. Rules are deterministic and evaluated in a fixed
 * order; a rule may assume every earlier rule passed.
 */
public interface ComplianceRule {

    /** Unique rule identifier, e.g. "policy-coverage". */
    String ruleId();

    RuleResult evaluate(ComplianceRequest request);

    sealed interface RuleResult {
        record Pass() implements RuleResult {}
        record Violation(String reason) implements RuleResult {}

        static RuleResult pass() {
            return new Pass();
        }
    }
}
