package com.driftsentinel.core.source;

import java.util.OptionalInt;

/**
 * Thrown by {@link MetricSource} and {@link AlertSink} implementations when a
 * store call did not complete: timeout, connection failure, non-2xx status
 * or an unreadable response body.
 *
 * @since 1.0.0
 */
public class MonitoringStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** HTTP status, or -1 when the failure happened below HTTP. */
    private final int statusCode;

    public MonitoringStoreException(String message) {
        this(message, -1, null);
    }

    public MonitoringStoreException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public MonitoringStoreException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public MonitoringStoreException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status that caused the failure, if any
     */
    public OptionalInt getStatusCode() {
        return statusCode >= 0 ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }
}
