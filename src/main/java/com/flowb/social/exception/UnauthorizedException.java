package com.flowb.social.exception;

/**
 * Thrown when the caller's crew role is below what an operation requires.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
