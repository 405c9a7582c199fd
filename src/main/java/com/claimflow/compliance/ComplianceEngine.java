package com.claimflow.compliance;

import com.claimflow.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks a claim against its policy.
 *
 * Rules run in registration order and the first violation wins; later rules are
 * not evaluated. The engine is total: a failure inside a rule (for example a
 * malformed policy record) becomes a non-compliant result, never an exception.
 */
public class ComplianceEngine {

    private static final Logger log = LoggerFactory.getLogger(ComplianceEngine.class);

    private final List<ComplianceRule> rules;

    public ComplianceEngine(List<ComplianceRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The standard rule order: required fields, policy number format, policy
     * existence, coverage, exclusions.
     */
    public static ComplianceEngine standard(PolicyStore policyStore) {
        return new ComplianceEngine(List.of(
            new RequiredFieldsRule(),
            new PolicyNumberFormatRule(),
            new PolicyExistsRule(policyStore),
            new CoverageRule(policyStore),
            new ExclusionRule(policyStore)
        ));
    }

    public ComplianceResult checkCompliance(String policyNumber, String claimType, String claimText) {
        return check(new ComplianceRequest(policyNumber, claimType, claimText));
    }

    public ComplianceResult check(ComplianceRequest request) {
        log.info("Checking policy compliance for policy_number={}", request.policyNumber());

        String currentRule = "none";
        try {
            for (ComplianceRule rule : rules) {
                currentRule = rule.ruleId();
                ComplianceRule.RuleResult result = rule.evaluate(request);
                if (result instanceof ComplianceRule.RuleResult.Violation violation) {
                    log.info("Claim non-compliant per rule {}: {}", rule.ruleId(), violation.reason());
                    return ComplianceResult.violation(rule.ruleId(), violation.reason());
                }
            }
        } catch (RuntimeException ex) {
            log.error("Compliance check failed in rule {}", currentRule, ex);
            return ComplianceResult.violation(currentRule, "compliance check failed: " + ex.getMessage());
        }

        log.info("Policy {} is compliant", request.policyNumber());
        return ComplianceResult.passed();
    }

    public List<String> ruleIds() {
        return rules.stream().map(ComplianceRule::ruleId).toList();
    }
}
