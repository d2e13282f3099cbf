package com.panwatch.domain.enums;

/**
 * Phases of one agent execution. Phases run strictly in declaration order;
 * FAILED is reachable from any phase before DONE.
 */
public enum ExecutionState {
    RESOLVING,
    FETCHING,
    ANALYZING,
    CLASSIFYING,
    NOTIFYING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
