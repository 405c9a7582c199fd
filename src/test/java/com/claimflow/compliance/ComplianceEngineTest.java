package com.claimflow.compliance;

import com.claimflow.policy.InMemoryPolicyStore;
import com.claimflow.policy.Policy;
import com.claimflow.policy.PolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceEngineTest {

    private ComplianceEngine engine;

    @BeforeEach
    void setUp() {
        PolicyStore store = new InMemoryPolicyStore(List.of(
            new Policy("PN-AUTO-1001", Set.of("collision"), List.of()),
            new Policy("PN-HOME-2002", Set.of("fire", "theft"), List.of("flood", "war", "intentional"))
        ));
        engine = ComplianceEngine.standard(store);
    }

    @Test
    void standardRuleOrder() {
        assertEquals(List.of("required-fields", "policy-number-format", "policy-exists",
            "policy-coverage", "policy-exclusions"), engine.ruleIds());
    }

    @Test
    void compliantClaim() {
        ComplianceResult result = engine.checkCompliance("PN-AUTO-1001", "collision", "major collision damage");

        assertTrue(result.compliant());
        assertEquals("compliant", result.reason());
        assertEquals(ComplianceResult.passed(), result);
        assertEquals("all-rules-passed", result.ruleId());
    }

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        void anyMissingFieldFailsFirst() {
            assertMissing(engine.checkCompliance(null, "collision", "text"));
            assertMissing(engine.checkCompliance("PN-AUTO-1001", "", "text"));
            assertMissing(engine.checkCompliance("PN-AUTO-1001", "collision", null));
        }

        @Test
        void missingFieldWinsOverBadFormat() {
            ComplianceResult result = engine.checkCompliance("not-a-policy", null, "text");
            assertMissing(result);
        }

        private void assertMissing(ComplianceResult result) {
            assertFalse(result.compliant());
            assertTrue(result.reason().startsWith("missing required field"), result.reason());
            assertEquals("required-fields", result.ruleId());
        }
    }

    @Nested
    @DisplayName("Policy number format")
    class PolicyNumberFormat {

        @ParameterizedTest
        @ValueSource(strings = {"PN-1001", "pn-auto-1001", "PN-AUTO-", "PN--1001", "XX-AUTO-1001",
            "PN-AUTO-1001X", " PN-AUTO-1001", "PN-AUT0-1001"})
        void malformedNumbersAreRejectedWithTheValue(String policyNumber) {
            ComplianceResult result = engine.checkCompliance(policyNumber, "collision", "collision damage");

            assertFalse(result.compliant());
            assertEquals("policy-number-format", result.ruleId());
            assertTrue(result.reason().contains(policyNumber), result.reason());
        }

        @Test
        void formatIsCheckedBeforeLookup() {
            // would not be found either, but format is reported
            ComplianceResult result = engine.checkCompliance("PN-99", "theft", "text");
            assertEquals("policy-number-format", result.ruleId());
        }
    }

    @Test
    void unknownPolicyIsNotFound() {
        ComplianceResult result = engine.checkCompliance("PN-AUTO-9999", "collision", "collision damage");

        assertFalse(result.compliant());
        assertEquals("policy not found: PN-AUTO-9999", result.reason());
    }

    @Test
    void uncoveredClaimTypeIsNamed() {
        ComplianceResult result = engine.checkCompliance("PN-AUTO-1001", "theft", "car stolen overnight");

        assertFalse(result.compliant());
        assertEquals("policy-coverage", result.ruleId());
        assertTrue(result.reason().contains("theft"));
    }

    @Nested
    @DisplayName("Exclusions")
    class Exclusions {

        @Test
        void exclusionMatchesInsideLongerWord() {
            ComplianceResult result = engine.checkCompliance("PN-HOME-2002", "theft", "warranty issue with stolen TV");

            assertFalse(result.compliant());
            assertEquals("policy-exclusions", result.ruleId());
            assertTrue(result.reason().contains("'war'"), result.reason());
        }

        @Test
        void matchingIsCaseInsensitive() {
            ComplianceResult result = engine.checkCompliance("PN-HOME-2002", "fire", "FLOOD followed by fire");
            assertTrue(result.reason().contains("'flood'"));
        }

        @Test
        void firstExclusionInPolicyOrderIsReported() {
            // text mentions "intentional" before "flood", policy lists flood first
            ComplianceResult result = engine.checkCompliance("PN-HOME-2002", "fire",
                "intentional fire after the flood");
            assertTrue(result.reason().contains("'flood'"), result.reason());
        }

        @Test
        void coverageIsCheckedBeforeExclusions() {
            ComplianceResult result = engine.checkCompliance("PN-HOME-2002", "collision", "war zone collision");
            assertEquals("policy-coverage", result.ruleId());
        }
    }

    @Nested
    @DisplayName("Failure containment")
    class FailureContainment {

        @Test
        void failingStoreBecomesNonCompliant() {
            ComplianceEngine broken = ComplianceEngine.standard(new FailingPolicyStore());

            ComplianceResult result = broken.checkCompliance("PN-AUTO-1001", "collision", "collision");

            assertFalse(result.compliant());
            assertEquals("policy-exists", result.ruleId());
            assertTrue(result.reason().startsWith("compliance check failed"), result.reason());
        }

        @Test
        void laterRulesAreNotEvaluatedAfterAViolation() {
            List<String> evaluated = new ArrayList<>();
            ComplianceEngine traced = new ComplianceEngine(List.of(
                tracing("first", evaluated, new ComplianceRule.RuleResult.Pass()),
                tracing("second", evaluated, new ComplianceRule.RuleResult.Violation("nope")),
                tracing("third", evaluated, new ComplianceRule.RuleResult.Pass())
            ));

            ComplianceResult result = traced.checkCompliance("PN-AUTO-1001", "collision", "text");

            assertEquals("nope", result.reason());
            assertEquals(List.of("first", "second"), evaluated);
        }
    }

    // ---- helpers ----

    private static ComplianceRule tracing(String id, List<String> evaluated, ComplianceRule.RuleResult outcome) {
        return new ComplianceRule() {
            @Override
            public String ruleId() {
                return id;
            }

            @Override
            public RuleResult evaluate(ComplianceRequest request) {
                evaluated.add(id);
                return outcome;
            }
        };
    }

    private static final class FailingPolicyStore implements PolicyStore {

        @Override
        public Optional<Policy> findById(String policyId) {
            throw new IllegalStateException("policy record is malformed");
        }

        @Override
        public Collection<Policy> all() {
            return List.of();
        }

        @Override
        public int size() {
            return 0;
        }
    }
}
