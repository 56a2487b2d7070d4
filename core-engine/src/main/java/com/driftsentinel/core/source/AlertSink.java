package com.driftsentinel.core.source;

import com.driftsentinel.core.model.Alert;

import java.util.List;
import java.util.Optional;

/**
 * Write/query access to the alert store.
 *
 * @since 1.0.0
 */
public interface AlertSink {

    /**
     * Persist a newly detected alert with status {@code open}.
     *
     * @param alert the alert to store, must not be {@code null}
     * @return the store-assigned id, or empty if the store accepted the write
     *         without returning one
     * @throws MonitoringStoreException if the write failed
     */
    Optional<String> write(Alert alert);

    /**
     * Query stored alerts, newest first.
     *
     * @param query filters and limit
     * @return matching alerts in store order
     * @throws MonitoringStoreException if the store could not be read
     */
    List<Alert> fetchAlerts(AlertQuery query);
}
