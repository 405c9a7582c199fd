package com.claimflow.classification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("High"),
    MEDIUM("Medium");

    private final String value;

    Priority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
