package com.driftsentinel.core.source;

import com.driftsentinel.core.model.AlertStatus;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Filters for {@link AlertSink#fetchAlerts(AlertQuery)}. Results are always
 * ordered by creation time, newest first.
 *
 * @since 1.0.0
 */
public final class AlertQuery {

    private final LocalDate since;
    private final AlertStatus status;
    private final Integer limit;

    private AlertQuery(Builder b) {
        this.since = b.since;
        this.status = b.status;
        this.limit = b.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalDate since;
        private AlertStatus status;
        private Integer limit;

        /** Only alerts whose metric date is on or after {@code since}. */
        public Builder since(LocalDate since) {
            this.since = since;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public AlertQuery build() {
            return new AlertQuery(this);
        }
    }

    public Optional<LocalDate> getSince() {
        return Optional.ofNullable(since);
    }

    public Optional<AlertStatus> getStatus() {
        return Optional.ofNullable(status);
    }

    public OptionalInt getLimit() {
        return limit != null ? OptionalInt.of(limit) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertQuery that))
            return false;
        return Objects.equals(since, that.since)
                && status == that.status
                && Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(since, status, limit);
    }

    @Override
    public String toString() {
        return "AlertQuery{since=" + since + ", status=" + status + ", limit=" + limit + '}';
    }
}
