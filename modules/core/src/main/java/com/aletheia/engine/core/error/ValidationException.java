package com.aletheia.engine.core.error;

/**
 * A malformed, duplicate or unauthorized request. Rejected immediately, never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
