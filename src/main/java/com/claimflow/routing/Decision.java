package com.claimflow.routing;

public enum Decision {
    FLAG_MANUAL_REVIEW("Flag for Manual Review"),
    AUTO_DENY("Auto-Deny"),
    ROUTE_SENIOR_ADJUSTER("Route to Senior Adjuster"),
    ROUTE_STP("Route to Straight-Through Processing (STP)"),
    ROUTE_GENERAL_QUEUE("Route to General Claims Queue");

    private final String label;

    Decision(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
