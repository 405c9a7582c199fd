package com.claimflow.routing;

import com.claimflow.classification.ClassificationResult;
import com.claimflow.classification.Priority;
import com.claimflow.compliance.ComplianceResult;
import com.claimflow.extraction.ExtractedEntities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutingEngineTest {

    private static final RoutingThresholds THRESHOLDS = new RoutingThresholds(0.6, 10000, 1000);

    private final RoutingEngine engine = RoutingEngine.standard();

    @Nested
    @DisplayName("Reference scenarios")
    class Scenarios {

        @Test
        void highPriorityHighValueGoesToSeniorAdjuster() {
            ClaimRecord claim = claim(12000.0, "collision", 0.9, Priority.HIGH, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_SENIOR_ADJUSTER, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void lowConfidenceIsFlaggedRegardlessOfCompliance() {
            ClaimRecord compliant = claim(12000.0, "collision", 0.4, Priority.HIGH, ComplianceResult.passed());
            ClaimRecord denied = claim(12000.0, "collision", 0.4, Priority.HIGH,
                ComplianceResult.violation("policy-coverage", "claim type 'collision' is not covered"));

            RoutingDecision decision = engine.route(compliant, THRESHOLDS);
            assertEquals(Decision.FLAG_MANUAL_REVIEW, decision.decision());
            assertEquals("Low classification confidence (0.40)", decision.reason());
            assertEquals(Decision.FLAG_MANUAL_REVIEW, engine.route(denied, THRESHOLDS).decision());
        }

        @Test
        void nonCompliantIsAutoDenied() {
            ComplianceResult notCovered = ComplianceResult.violation("policy-coverage", "claim type 'theft' is not covered");
            ClaimRecord claim = claim(500.0, "theft", 0.9, Priority.MEDIUM, notCovered);

            RoutingDecision decision = engine.route(claim, THRESHOLDS);

            assertEquals(Decision.AUTO_DENY, decision.decision());
            assertTrue(decision.reason().contains("theft"), decision.reason());
        }

        @Test
        void lowValueCompliantGoesStraightThrough() {
            ClaimRecord claim = claim(500.0, "theft", 0.9, Priority.MEDIUM, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_STP, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void missingValueFallsThroughToGeneralQueue() {
            ClaimRecord claim = claim(null, "theft", 0.9, Priority.MEDIUM, ComplianceResult.passed());

            RoutingDecision decision = engine.route(claim, THRESHOLDS);

            assertEquals(Decision.ROUTE_GENERAL_QUEUE, decision.decision());
            assertEquals("Standard claim", decision.reason());
        }
    }

    @Nested
    @DisplayName("Rule boundaries")
    class Boundaries {

        @Test
        void confidenceEqualToThresholdIsNotLow() {
            ClaimRecord claim = claim(500.0, "theft", 0.6, Priority.MEDIUM, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_STP, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void valueEqualToHighThresholdIsNotHighValue() {
            ClaimRecord claim = claim(10000.0, "theft", 0.9, Priority.MEDIUM, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_GENERAL_QUEUE, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void valueEqualToStpThresholdIsStraightThrough() {
            ClaimRecord claim = claim(1000.0, "theft", 0.9, Priority.MEDIUM, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_STP, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void zeroValueIsPresentAndGoesStraightThrough() {
            ClaimRecord claim = claim(0.0, "theft", 0.9, Priority.MEDIUM, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_STP, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void highPriorityWithoutValueGoesToSeniorAdjuster() {
            ClaimRecord claim = claim(null, "fire", 0.9, Priority.HIGH, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_SENIOR_ADJUSTER, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void highPriorityLowValueStillGoesToSeniorAdjuster() {
            ClaimRecord claim = claim(200.0, "fire", 0.9, Priority.HIGH, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_SENIOR_ADJUSTER, engine.route(claim, THRESHOLDS).decision());
        }

        @Test
        void stpThresholdAboveHighValueKeepsRuleOrder() {
            RoutingThresholds inverted = new RoutingThresholds(0.6, 1000, 5000);
            ClaimRecord claim = claim(3000.0, "theft", 0.9, Priority.MEDIUM, ComplianceResult.passed());
            assertEquals(Decision.ROUTE_SENIOR_ADJUSTER, engine.route(claim, inverted).decision());
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.1, 0.3, 0.59, 0.5999})
    void belowThresholdConfidenceAlwaysFlags(double confidence) {
        ClaimRecord claim = claim(50000.0, "collision", confidence, Priority.HIGH, ComplianceResult.passed());
        assertEquals(Decision.FLAG_MANUAL_REVIEW, engine.route(claim, THRESHOLDS).decision());
    }

    @Test
    void routingIsIdempotent() {
        ClaimRecord claim = claim(750.0, "theft", 0.8, Priority.MEDIUM, ComplianceResult.passed());
        RoutingDecision first = engine.route(claim, THRESHOLDS);
        RoutingDecision second = engine.route(claim, THRESHOLDS);
        assertEquals(first, second);
    }

    @Test
    void standardRulesAreEvaluatedInDeclarationOrder() {
        assertEquals(List.of(StandardRoutingRule.LOW_CONFIDENCE, StandardRoutingRule.NON_COMPLIANT,
                StandardRoutingRule.SENIOR_ADJUSTER, StandardRoutingRule.STRAIGHT_THROUGH,
                StandardRoutingRule.GENERAL_QUEUE),
            List.of(StandardRoutingRule.values()));
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        void nullRecordIsFlagged() {
            RoutingDecision decision = engine.route(null, THRESHOLDS);
            assertEquals(Decision.FLAG_MANUAL_REVIEW, decision.decision());
            assertTrue(decision.reason().startsWith("invalid claim record"));
        }

        @Test
        void recordWithoutComplianceIsFlagged() {
            ClaimRecord claim = new ClaimRecord(entities(500.0),
                new ClassificationResult("theft", 0.9, Priority.MEDIUM), null);
            RoutingDecision decision = engine.route(claim, THRESHOLDS);
            assertEquals(Decision.FLAG_MANUAL_REVIEW, decision.decision());
            assertTrue(decision.reason().contains("compliance"));
        }

        @Test
        void failingRuleIsFlagged() {
            RoutingRule exploding = new RoutingRule() {
                @Override
                public String ruleId() {
                    return "exploding";
                }

                @Override
                public boolean matches(ClaimRecord claim, RoutingThresholds thresholds) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public RoutingDecision decide(ClaimRecord claim, RoutingThresholds thresholds) {
                    throw new AssertionError("not reached");
                }
            };
            RoutingEngine broken = new RoutingEngine(List.of(exploding));

            RoutingDecision decision = broken.route(
                claim(500.0, "theft", 0.9, Priority.MEDIUM, ComplianceResult.passed()), THRESHOLDS);

            assertEquals(Decision.FLAG_MANUAL_REVIEW, decision.decision());
            assertEquals("routing error: boom", decision.reason());
        }
    }

    // ---- helpers ----

    private static ClaimRecord claim(Double value, String type, double confidence,
                                     Priority priority, ComplianceResult compliance) {
        return new ClaimRecord(entities(value), new ClassificationResult(type, confidence, priority), compliance);
    }

    private static ExtractedEntities entities(Double value) {
        return new ExtractedEntities(List.of("John Smith"), List.of("03/14/2024"), "PN-AUTO-1001", value);
    }
}
