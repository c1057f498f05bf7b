package com.flowb.social.exception;

/**
 * Exception thrown when an operation is not allowed due to the current state
 * of the resource.
 *
 * For example, joining a closed crew or approving a request that was already denied.
 */
public class IllegalOperationException extends RuntimeException {

    public IllegalOperationException(String message) {
        super(message);
    }

    public IllegalOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
