package com.claimflow.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured fields pulled out of one claim document. Immutable once built.
 *
 * @param policyNumber raw policy number as written on the form, not validated
 * @param claimValue   claimed amount, or {@code null} when the form states none
 */
public record ExtractedEntities(
    @JsonProperty("person_names") List<String> personNames,
    @JsonProperty("dates") List<String> dates,
    @JsonProperty("policy_number") String policyNumber,
    @JsonProperty("claim_value") Double claimValue
) {

    public ExtractedEntities {
        personNames = personNames == null ? List.of() : List.copyOf(personNames);
        dates = dates == null ? List.of() : List.copyOf(dates);
        if (claimValue != null && (claimValue < 0 || claimValue.isNaN())) {
            throw new IllegalArgumentException("claimValue must be non-negative: " + claimValue);
        }
    }

    @JsonIgnore
    public boolean hasClaimValue() {
        return claimValue != null;
    }
}
