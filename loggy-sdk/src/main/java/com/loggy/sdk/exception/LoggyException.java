package com.loggy.sdk.exception;

/**
 * Base exception for Loggy SDK errors.
 *
 * <p>Never thrown out of a logging call. Delivery problems are wrapped in this
 * type and handed to the configured
 * {@link com.loggy.sdk.client.DeliveryFailureCallback}.</p>
 */
public class LoggyException extends RuntimeException {

    private final int statusCode;

    public LoggyException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public LoggyException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public LoggyException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the collector, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
