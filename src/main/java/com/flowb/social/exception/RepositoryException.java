package com.flowb.social.exception;

/**
 * Exception thrown when repository operations fail.
 * Wraps data store failures with meaningful messages so the caller can retry.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
