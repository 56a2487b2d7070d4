/**
 * Drift detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.driftsentinel.core.detection.AnomalyDetector}
 * interface and are instantiated via
 * {@link com.driftsentinel.core.detection.DetectorFactory}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@link com.driftsentinel.core.detection.RateSpikeDetector}: fallback,
 * error and duplicate rate against baseline, with an absolute floor for zero
 * baselines</li>
 * <li>{@link com.driftsentinel.core.detection.LatencySpikeDetector}: p95
 * latency against baseline, inert without baseline data</li>
 * <li>{@link com.driftsentinel.core.detection.HealthDeclineDetector}: health
 * score against an ideal of 100</li>
 * </ul>
 *
 * <p>
 * {@link com.driftsentinel.core.detection.DriftDetector} wires them to a
 * metric source and an alert sink.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.detection;
