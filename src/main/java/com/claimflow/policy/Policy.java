package com.claimflow.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A coverage agreement: the claim types it pays for and the exclusion
 * phrases that void a claim. Exclusions keep their configured order and are
 * stored lower-cased.
 */
public record Policy(
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("coverage") Set<String> coverage,
    @JsonProperty("exclusions") List<String> exclusions
) {

    /** Policy identifiers look like {@code PN-AUTO-1001}. */
    public static final Pattern ID_FORMAT = Pattern.compile("PN-[A-Z]+-\\d+");

    public Policy {
        Objects.requireNonNull(policyId, "policyId is required");
        Objects.requireNonNull(coverage, "coverage is required");
        Objects.requireNonNull(exclusions, "exclusions is required");
        coverage = Collections.unmodifiableSet(new LinkedHashSet<>(coverage));
        exclusions = exclusions.stream()
            .map(phrase -> phrase.toLowerCase(Locale.ROOT))
            .toList();
    }

    public boolean covers(String claimType) {
        return coverage.contains(claimType);
    }
}
