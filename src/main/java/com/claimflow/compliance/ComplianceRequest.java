package com.claimflow.compliance;

/**
 * The three inputs a compliance check looks at. Any of them may be null.
 */
public record ComplianceRequest(String policyNumber, String claimType, String claimText) {}
