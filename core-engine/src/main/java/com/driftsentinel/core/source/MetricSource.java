package com.driftsentinel.core.source;

import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to pre-aggregated daily metrics and rolling baselines.
 *
 * <p>
 * Implementations must be safe to call from several threads. A missing row
 * is reported as an empty result; anything that prevented the read from
 * completing is reported as a {@link MonitoringStoreException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricSource {

    /**
     * Fetch the aggregates for a single day.
     *
     * @param date calendar day, must not be {@code null}
     * @return the snapshot, or empty if no row exists for {@code date}
     * @throws MonitoringStoreException if the store could not be read
     */
    Optional<MetricSnapshot> fetchMetric(LocalDate date);

    /**
     * Fetch every daily snapshot on or after {@code since}.
     *
     * @param since first calendar day to include, must not be {@code null}
     * @return snapshots ordered newest first, possibly empty
     * @throws MonitoringStoreException if the store could not be read
     */
    List<MetricSnapshot> fetchMetricsSince(LocalDate since);

    /**
     * Fetch a named baseline.
     *
     * @param baselineName baseline key, e.g. {@code 7day_rolling}
     * @return the baseline, or empty if none is stored under that name
     * @throws MonitoringStoreException if the store could not be read or the row
     *                                  is malformed
     */
    Optional<BaselineSnapshot> fetchBaseline(String baselineName);
}
