package com.claimflow.routing;

/**
 * One step of the routing decision tree. The engine asks each rule in order
 * whether it {@link #matches}; the first one that does {@link #decide}s.
 */
public interface RoutingRule {

    String ruleId();

    boolean matches(ClaimRecord claim, RoutingThresholds thresholds);

    RoutingDecision decide(ClaimRecord claim, RoutingThresholds thresholds);
}
