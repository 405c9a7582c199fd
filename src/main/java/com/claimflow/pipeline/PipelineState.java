package com.claimflow.pipeline;

public enum PipelineState {
    EXTRACTING,
    CLASSIFYING,
    CHECKING_COMPLIANCE,
    ROUTING,
    DONE,
    FAILED;

    /** A run stops stepping once it reaches DONE or FAILED. */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
