package com.codecrucible.core.workflow;

/**
 * Where a run currently is.
 *
 * CREATED → GENERATING → (CHECKING_BUGS ⇄ FIXING)* → [FEATURE_INJECTION]* → COMPLETED
 *
 * FAILED is reachable from any non-terminal phase.
 */
public enum WorkflowPhase {
    CREATED,
    GENERATING,
    CHECKING_BUGS,
    FIXING,
    FEATURE_INJECTION,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
