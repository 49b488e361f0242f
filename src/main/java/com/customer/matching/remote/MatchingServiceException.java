package com.customer.matching.remote;

/**
 * Thrown when the remote matching service cannot be used: transport failure,
 * non-success status, or a payload that does not have the expected shape.
 */
public class MatchingServiceException extends RuntimeException {

    private final int statusCode;

    public MatchingServiceException(String message) {
        this(message, -1, null);
    }

    public MatchingServiceException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public MatchingServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Returns the HTTP status code, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
