/**
 * Ports to the external metric and alert stores.
 *
 * <p>
 * The core never talks to a store directly; it reads through
 * {@link com.driftsentinel.core.source.MetricSource} and writes through
 * {@link com.driftsentinel.core.source.AlertSink}. Failures surface as
 * {@link com.driftsentinel.core.source.MonitoringStoreException}, which the
 * services catch and degrade to empty results.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.source;
