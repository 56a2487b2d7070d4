package com.driftsentinel.rest;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable configuration for the REST metric and alert store.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * Only {@code SUPABASE_URL} and {@code SUPABASE_KEY} are required.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class StoreConfig {

    // ---------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------
    private final String baseUrl;
    private final String apiKey;

    // ---------------------------------------------------------------
    // Timeouts / retry
    // ---------------------------------------------------------------
    private final Duration pointReadTimeout;
    private final Duration windowReadTimeout;
    private final Duration writeTimeout;
    private final int maxRetries;
    private final Duration retryBackoff;

    // ---------------------------------------------------------------
    // Relations
    // ---------------------------------------------------------------
    private final String metricsRelation;
    private final String baselineRelation;
    private final String alertsRelation;

    private StoreConfig(Builder b) {
        this.baseUrl = stripTrailingSlash(b.baseUrl);
        this.apiKey = b.apiKey;
        this.pointReadTimeout = b.pointReadTimeout;
        this.windowReadTimeout = b.windowReadTimeout;
        this.writeTimeout = b.writeTimeout;
        this.maxRetries = b.maxRetries;
        this.retryBackoff = b.retryBackoff;
        this.metricsRelation = b.metricsRelation;
        this.baselineRelation = b.baselineRelation;
        this.alertsRelation = b.alertsRelation;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link StoreConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a required value is missing or out of
     *                                  range
     */
    public static StoreConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static StoreConfig fromEnvironment(Function<String, String> env) {
        try {
            return new Builder()
                    .baseUrl(env(env, "SUPABASE_URL", null))
                    .apiKey(env(env, "SUPABASE_KEY", null))
                    .pointReadTimeout(Duration.ofMillis(Long.parseLong(
                            env(env, "STORE_POINT_READ_TIMEOUT_MS", "10000"))))
                    .windowReadTimeout(Duration.ofMillis(Long.parseLong(
                            env(env, "STORE_WINDOW_READ_TIMEOUT_MS", "30000"))))
                    .writeTimeout(Duration.ofMillis(Long.parseLong(
                            env(env, "STORE_WRITE_TIMEOUT_MS", "10000"))))
                    .maxRetries(Integer.parseInt(env(env, "STORE_MAX_RETRIES", "0")))
                    .retryBackoff(Duration.ofMillis(Long.parseLong(
                            env(env, "STORE_RETRY_BACKOFF_MS", "200"))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Duration getPointReadTimeout() {
        return pointReadTimeout;
    }

    public Duration getWindowReadTimeout() {
        return windowReadTimeout;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public String getMetricsRelation() {
        return metricsRelation;
    }

    public String getBaselineRelation() {
        return baselineRelation;
    }

    public String getAlertsRelation() {
        return alertsRelation;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link StoreConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the URL and key are present,
     * timeouts are positive, retries are non-negative and relation names are
     * non-blank.
     * </p>
     */
    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration pointReadTimeout = Duration.ofSeconds(10);
        private Duration windowReadTimeout = Duration.ofSeconds(30);
        private Duration writeTimeout = Duration.ofSeconds(10);
        private int maxRetries = 0;
        private Duration retryBackoff = Duration.ofMillis(200);
        private String metricsRelation = "mv_daily_metrics";
        private String baselineRelation = "monitoring_baseline";
        private String alertsRelation = "monitoring_alerts";

        public Builder baseUrl(String v) {
            this.baseUrl = v;
            return this;
        }

        public Builder apiKey(String v) {
            this.apiKey = v;
            return this;
        }

        public Builder pointReadTimeout(Duration v) {
            this.pointReadTimeout = v;
            return this;
        }

        public Builder windowReadTimeout(Duration v) {
            this.windowReadTimeout = v;
            return this;
        }

        public Builder writeTimeout(Duration v) {
            this.writeTimeout = v;
            return this;
        }

        public Builder maxRetries(int v) {
            this.maxRetries = v;
            return this;
        }

        public Builder retryBackoff(Duration v) {
            this.retryBackoff = v;
            return this;
        }

        public Builder metricsRelation(String v) {
            this.metricsRelation = v;
            return this;
        }

        public Builder baselineRelation(String v) {
            this.baselineRelation = v;
            return this;
        }

        public Builder alertsRelation(String v) {
            this.alertsRelation = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link StoreConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public StoreConfig build() {
            requireNonBlank(baseUrl, "baseUrl (SUPABASE_URL)");
            requireNonBlank(apiKey, "apiKey (SUPABASE_KEY)");
            requireNonBlank(metricsRelation, "metricsRelation");
            requireNonBlank(baselineRelation, "baselineRelation");
            requireNonBlank(alertsRelation, "alertsRelation");
            if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
                throw new IllegalArgumentException("baseUrl must be an http(s) URL, got: " + baseUrl);
            }
            requirePositive(pointReadTimeout, "pointReadTimeout");
            requirePositive(windowReadTimeout, "windowReadTimeout");
            requirePositive(writeTimeout, "writeTimeout");
            Objects.requireNonNull(retryBackoff, "retryBackoff required");
            if (retryBackoff.isNegative()) {
                throw new IllegalArgumentException("retryBackoff must be >= 0, got: " + retryBackoff);
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            return new StoreConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "baseUrl='" + baseUrl + '\'' +
                ", apiKey='***'" +
                ", pointReadTimeout=" + pointReadTimeout +
                ", windowReadTimeout=" + windowReadTimeout +
                ", writeTimeout=" + writeTimeout +
                ", maxRetries=" + maxRetries +
                ", retryBackoff=" + retryBackoff +
                ", metricsRelation='" + metricsRelation + '\'' +
                ", baselineRelation='" + baselineRelation + '\'' +
                ", alertsRelation='" + alertsRelation + '\'' +
                '}';
    }
}
