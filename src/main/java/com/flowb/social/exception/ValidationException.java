package com.flowb.social.exception;

/**
 * Thrown when caller input is missing or malformed. No state has changed.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
