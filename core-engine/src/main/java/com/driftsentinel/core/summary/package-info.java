/**
 * Dashboard summaries over a trailing window of metrics and alerts.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.summary;
