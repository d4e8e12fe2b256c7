package com.whereq.foundry.exception;

/**
 * Exception thrown when a job has no output file matching a download request
 */
public class OutputNotFoundException extends FoundryException {

    public OutputNotFoundException(String message) {
        super(message);
    }
}
