package com.claimflow.routing;

import com.claimflow.config.ClaimsConfig;

/**
 * Numeric limits the routing rules compare against.
 *
 * {@code stpThreshold <= highValueThreshold} is expected but not enforced; when it
 * does not hold, the senior adjuster rule still wins because it is evaluated first.
 */
public record RoutingThresholds(double confidenceThreshold, double highValueThreshold, double stpThreshold) {

    public RoutingThresholds {
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]: " + confidenceThreshold);
        }
        if (highValueThreshold < 0 || stpThreshold < 0) {
            throw new IllegalArgumentException("value thresholds must be non-negative");
        }
    }

    public static RoutingThresholds from(ClaimsConfig config) {
        return new RoutingThresholds(
            config.confidenceThreshold(),
            config.routingRules().highValueThreshold(),
            config.routingRules().stpThreshold()
        );
    }
}
