package com.flowb.social.exception;

/**
 * Exception thrown when a call to the REST data store fails.
 * Carries the table and, when the store answered, the HTTP status it returned.
 */
public class DataStoreException extends RuntimeException {

    private final ErrorType errorType;
    private final String table;
    private final int statusCode;

    public enum ErrorType {
        /**
         * The store answered with a non-2xx status.
         */
        REJECTED,

        /**
         * The store could not be reached or timed out.
         */
        UNAVAILABLE,

        /**
         * The request or response body could not be mapped.
         */
        MAPPING
    }

    public DataStoreException(ErrorType errorType, String table, int statusCode, String message) {
        super(message);
        this.errorType = errorType;
        this.table = table;
        this.statusCode = statusCode;
    }

    public DataStoreException(ErrorType errorType, String table, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.table = table;
        this.statusCode = statusCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getTable() {
        return table;
    }

    /**
     * HTTP status returned by the store, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public static DataStoreException rejected(String table, int statusCode, String body) {
        return new DataStoreException(
                ErrorType.REJECTED,
                table,
                statusCode,
                "Data store rejected request on " + table + " with status " + statusCode + ": " + body
        );
    }

    public static DataStoreException unavailable(String table, Throwable cause) {
        return new DataStoreException(
                ErrorType.UNAVAILABLE,
                table,
                0,
                "Data store is unavailable for " + table,
                cause
        );
    }

    public static DataStoreException mapping(String table, Throwable cause) {
        return new DataStoreException(
                ErrorType.MAPPING,
                table,
                0,
                "Failed to map data store payload for " + table,
                cause
        );
    }
}
