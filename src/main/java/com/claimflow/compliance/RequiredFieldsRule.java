package com.claimflow.compliance;

public class RequiredFieldsRule implements ComplianceRule {

    static final String MISSING_FIELD_REASON = "missing required field (policy number, claim type or claim text)";

    @Override
    public String ruleId() {
        return "required-fields";
    }

    @Override
    public RuleResult evaluate(ComplianceRequest request) {
        if (isBlank(request.policyNumber()) || isBlank(request.claimType()) || isBlank(request.claimText())) {
            return new RuleResult.Violation(MISSING_FIELD_REASON);
        }
        return RuleResult.pass();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
