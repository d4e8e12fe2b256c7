package com.whereq.foundry.model;

/**
 * Outcome of a cancellation request
 */
public enum CancelResult {
    /**
     * No such job
     */
    NOT_FOUND,

    /**
     * Job had already reached a terminal status; nothing was changed
     */
    ALREADY_FINISHED,

    /**
     * Worker exited after the graceful signal
     */
    CANCELLED,

    /**
     * Worker ignored the graceful signal and was killed
     */
    KILLED;

    public boolean isCancelled() {
        return this == CANCELLED || this == KILLED;
    }
}
