/**
 * Configuration loading and validation for the drift detector.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.driftsentinel.core.config.MonitoringConfigLoader} into a
 * {@link com.driftsentinel.core.config.MonitoringConfig} instance. Validation
 * runs automatically after parsing so a bad file fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.config;
