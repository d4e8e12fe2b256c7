package com.whereq.foundry.exception;

/**
 * Base exception for job supervision errors surfaced to callers
 */
public class FoundryException extends RuntimeException {
    public FoundryException(String message) {
        super(message);
    }

    public FoundryException(String message, Throwable cause) {
        super(message, cause);
    }
}
