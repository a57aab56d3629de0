package com.codecrucible.core.workflow;

import java.util.Optional;

/**
 * Persistence seam for workflow entries. Long-term storage is owned outside
 * the engine; any failure to write is fatal to the run that attempted it.
 */
public interface WorkflowStore {

    /**
     * Stores a new entry and returns the id assigned to it. The id is also set
     * on {@code entry}.
     */
    String create(WorkflowEntry entry) throws PersistenceException;

    /** Overwrites the stored state of an existing entry. */
    void update(WorkflowEntry entry) throws PersistenceException;

    Optional<WorkflowEntry> findById(String id);

    // =========================================================================
    // Exception
    // =========================================================================

    class PersistenceException extends Exception {
        public PersistenceException(String message) {
            super(message);
        }

        public PersistenceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
