package com.codecrucible.core.workflow;

public enum WorkflowStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
