package com.claimflow.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Picks the handling queue for a claim.
 *
 * Stateless: the same record and thresholds always give the same decision.
 * A malformed record or a failing rule flags the claim for manual review
 * instead of throwing.
 */
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final List<RoutingRule> rules;

    public RoutingEngine(List<? extends RoutingRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RoutingEngine standard() {
        return new RoutingEngine(List.of(StandardRoutingRule.values()));
    }

    public RoutingDecision route(ClaimRecord claim, RoutingThresholds thresholds) {
        log.info("Determining route for the claim");

        String problem = describeMalformed(claim, thresholds);
        if (problem != null) {
            log.error("Invalid claim record: {}", problem);
            return new RoutingDecision(Decision.FLAG_MANUAL_REVIEW, "invalid claim record: " + problem);
        }

        try {
            for (RoutingRule rule : rules) {
                if (rule.matches(claim, thresholds)) {
                    RoutingDecision decision = rule.decide(claim, thresholds);
                    log.info("Routing rule {} matched: {} ({})",
                        rule.ruleId(), decision.decision(), decision.reason());
                    return decision;
                }
            }
        } catch (RuntimeException ex) {
            log.error("Routing error", ex);
            return new RoutingDecision(Decision.FLAG_MANUAL_REVIEW, "routing error: " + ex.getMessage());
        }

        // unreachable with the standard rules, GENERAL_QUEUE matches everything
        log.error("No routing rule matched among {} rules", rules.size());
        return new RoutingDecision(Decision.FLAG_MANUAL_REVIEW, "no routing rule matched");
    }

    private static String describeMalformed(ClaimRecord claim, RoutingThresholds thresholds) {
        if (claim == null) {
            return "claim record is missing";
        }
        if (thresholds == null) {
            return "routing thresholds are missing";
        }
        if (claim.entities() == null) {
            return "extracted entities are missing";
        }
        if (claim.classification() == null) {
            return "classification is missing";
        }
        if (claim.compliance() == null) {
            return "compliance outcome is missing";
        }
        return null;
    }
}
