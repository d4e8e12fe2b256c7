package com.whereq.foundry.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * RUNNING → {COMPLETED, FAILED, CANCELLED}
 * Terminal states are final; only deletion removes a terminal job.
 */
public enum JobStatus {
    /**
     * Worker process is alive and being drained
     */
    RUNNING,

    /**
     * Worker exited with code 0
     */
    COMPLETED,

    /**
     * Worker exited with a non-zero code, or its output could not be monitored
     */
    FAILED,

    /**
     * Caller-initiated cancellation
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
