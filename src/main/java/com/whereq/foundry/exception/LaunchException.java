package com.whereq.foundry.exception;

/**
 * Exception thrown when a worker process cannot be started. No job exists afterwards.
 */
public class LaunchException extends FoundryException {
    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
