/**
 * PostgREST-backed implementations of the metric source and alert sink.
 *
 * <p>
 * {@link com.driftsentinel.rest.StoreConfig} reads connection settings from
 * the environment; {@link com.driftsentinel.rest.DriftSentinel} wires them
 * into ready-to-use detection and summary services.
 * </p>
 */
package com.driftsentinel.rest;
