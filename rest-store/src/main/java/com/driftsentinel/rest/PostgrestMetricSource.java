package com.driftsentinel.rest;

import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.source.MalformedRecordException;
import com.driftsentinel.core.source.MetricSource;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MetricSource} backed by the daily metrics view and the baseline table
 * of a PostgREST store.
 *
 * <p>
 * Point reads use {@link StoreConfig#getPointReadTimeout()}; the window read
 * uses {@link StoreConfig#getWindowReadTimeout()}.
 * </p>
 *
 * @since 1.0.0
 */
public class PostgrestMetricSource implements MetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(PostgrestMetricSource.class);

    private final PostgrestClient client;
    private final StoreConfig config;
    private final RecordCodec codec;

    public PostgrestMetricSource(StoreConfig config) {
        this(new PostgrestClient(config), config, new RecordCodec());
    }

    PostgrestMetricSource(PostgrestClient client, StoreConfig config, RecordCodec codec) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public Optional<MetricSnapshot> fetchMetric(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        Map<String, String> params = new LinkedHashMap<>();
        params.put("metric_date", "eq." + date);
        params.put("limit", "1");

        JsonNode rows = client.select(config.getMetricsRelation(), params, config.getPointReadTimeout());
        if (rows.isEmpty()) {
            LOG.debug("No metrics row for {}", date);
            return Optional.empty();
        }
        return Optional.of(codec.toMetricSnapshot(rows.get(0)));
    }

    @Override
    public List<MetricSnapshot> fetchMetricsSince(LocalDate since) {
        Objects.requireNonNull(since, "since must not be null");
        Map<String, String> params = new LinkedHashMap<>();
        params.put("metric_date", "gte." + since);
        params.put("order", "metric_date.desc");

        JsonNode rows = client.select(config.getMetricsRelation(), params, config.getWindowReadTimeout());
        List<MetricSnapshot> snapshots = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            try {
                snapshots.add(codec.toMetricSnapshot(row));
            } catch (MalformedRecordException e) {
                LOG.warn("Skipping malformed metrics row {}: {}", row.path("metric_date").asText("?"),
                        e.getMessage());
            }
        }
        LOG.debug("Fetched {} metrics rows since {}", snapshots.size(), since);
        return snapshots;
    }

    @Override
    public Optional<BaselineSnapshot> fetchBaseline(String baselineName) {
        Objects.requireNonNull(baselineName, "baselineName must not be null");
        Map<String, String> params = new LinkedHashMap<>();
        params.put("baseline_name", "eq." + baselineName);
        params.put("limit", "1");

        JsonNode rows = client.select(config.getBaselineRelation(), params, config.getPointReadTimeout());
        if (rows.isEmpty()) {
            LOG.debug("No baseline named '{}'", baselineName);
            return Optional.empty();
        }
        return Optional.of(codec.toBaselineSnapshot(rows.get(0)));
    }
}
