package com.driftsentinel.core.source;

/**
 * A stored row was read but could not be turned into a valid model object,
 * e.g. a baseline with negative rates.
 *
 * @since 1.0.0
 */
public class MalformedRecordException extends MonitoringStoreException {

    private static final long serialVersionUID = 1L;

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
