/**
 * Domain model for Drift Sentinel.
 *
 * <p>
 * Value objects shared between the detection engine, the summary service and
 * the store adapters:
 * </p>
 * <ul>
 * <li>{@link com.driftsentinel.core.model.MetricSnapshot}: one day of
 * aggregated metrics</li>
 * <li>{@link com.driftsentinel.core.model.BaselineSnapshot}: rolling-window
 * reference values</li>
 * <li>{@link com.driftsentinel.core.model.ThresholdConfig}: deviation ratio
 * to severity mapping</li>
 * <li>{@link com.driftsentinel.core.model.Alert}: a detected anomaly</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.model;
