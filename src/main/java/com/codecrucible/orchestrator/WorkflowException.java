package com.codecrucible.orchestrator;

/**
 * A run could not complete. The entry (when one was created) is marked FAILED
 * with this message before the exception reaches the caller.
 */
public class WorkflowException extends Exception {

    private final String entryId;

    public WorkflowException(String message, String entryId, Throwable cause) {
        super(message, cause);
        this.entryId = entryId;
    }

    /** Id of the failed entry, or {@code null} when the entry was never stored. */
    public String getEntryId() {
        return entryId;
    }
}
