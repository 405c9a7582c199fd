package com.claimflow.routing;

import com.claimflow.classification.Priority;

import java.util.Locale;

/**
 * The routing decision tree. Declaration order is evaluation order, and it is
 * significant: a rule only sees claims that every earlier rule let through.
 */
public enum StandardRoutingRule implements RoutingRule {

    LOW_CONFIDENCE("low-confidence") {
        @Override
        public boolean matches(ClaimRecord claim, RoutingThresholds thresholds) {
            return claim.classification().confidence() < thresholds.confidenceThreshold();
        }

        @Override
        public RoutingDecision decide(ClaimRecord claim, RoutingThresholds thresholds) {
            return new RoutingDecision(Decision.FLAG_MANUAL_REVIEW,
                String.format(Locale.ROOT, "Low classification confidence (%.2f)",
                    claim.classification().confidence()));
        }
    },

    NON_COMPLIANT("non-compliant") {
        @Override
        public boolean matches(ClaimRecord claim, RoutingThresholds thresholds) {
            return !claim.compliance().compliant();
        }

        @Override
        public RoutingDecision decide(ClaimRecord claim, RoutingThresholds thresholds) {
            return new RoutingDecision(Decision.AUTO_DENY, "Non-compliant: " + claim.compliance().reason());
        }
    },

    SENIOR_ADJUSTER("senior-adjuster") {
        @Override
        public boolean matches(ClaimRecord claim, RoutingThresholds thresholds) {
            Double value = claim.claimValue();
            return claim.classification().priority() == Priority.HIGH
                || (value != null && value > thresholds.highValueThreshold());
        }

        @Override
        public RoutingDecision decide(ClaimRecord claim, RoutingThresholds thresholds) {
            return new RoutingDecision(Decision.ROUTE_SENIOR_ADJUSTER, "High priority or high value claim");
        }
    },

    // A missing value is not a zero value: claims without one skip STP.
    STRAIGHT_THROUGH("straight-through") {
        @Override
        public boolean matches(ClaimRecord claim, RoutingThresholds thresholds) {
            Double value = claim.claimValue();
            return value != null && value <= thresholds.stpThreshold();
        }

        @Override
        public RoutingDecision decide(ClaimRecord claim, RoutingThresholds thresholds) {
            return new RoutingDecision(Decision.ROUTE_STP, "Low-value, compliant claim");
        }
    },

    GENERAL_QUEUE("general-queue") {
        @Override
        public boolean matches(ClaimRecord claim, RoutingThresholds thresholds) {
            return true;
        }

        @Override
        public RoutingDecision decide(ClaimRecord claim, RoutingThresholds thresholds) {
            return new RoutingDecision(Decision.ROUTE_GENERAL_QUEUE, "Standard claim");
        }
    };

    private final String ruleId;

    StandardRoutingRule(String ruleId) {
        this.ruleId = ruleId;
    }

    @Override
    public String ruleId() {
        return ruleId;
    }
}
