package com.driftsentinel.rest;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.source.AlertQuery;
import com.driftsentinel.core.source.AlertSink;
import com.driftsentinel.core.source.MalformedRecordException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AlertSink} backed by the alerts table of a PostgREST store.
 *
 * <p>
 * Rows that cannot be mapped to an {@link Alert} are skipped with a warning
 * so that a single bad row does not hide the rest of the result.
 * </p>
 *
 * @since 1.0.0
 */
public class PostgrestAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(PostgrestAlertSink.class);

    private final PostgrestClient client;
    private final StoreConfig config;
    private final RecordCodec codec;

    public PostgrestAlertSink(StoreConfig config) {
        this(new PostgrestClient(config), config, new RecordCodec());
    }

    PostgrestAlertSink(PostgrestClient client, StoreConfig config, RecordCodec codec) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public Optional<String> write(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        JsonNode inserted = client.insert(config.getAlertsRelation(), codec.toAlertPayload(alert));

        JsonNode row = inserted.isArray() ? inserted.path(0) : inserted;
        JsonNode id = row.get("id");
        if (id == null || id.isNull()) {
            LOG.debug("Store accepted {} alert without returning an id", alert.getAlertType().getValue());
            return Optional.empty();
        }
        return Optional.of(id.asText());
    }

    @Override
    public List<Alert> fetchAlerts(AlertQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        Map<String, String> params = new LinkedHashMap<>();
        query.getSince().ifPresent(since -> params.put("metric_date", "gte." + since));
        query.getStatus().ifPresent(status -> params.put("status", "eq." + status.getValue()));
        params.put("order", "created_at.desc");
        query.getLimit().ifPresent(limit -> params.put("limit", Integer.toString(limit)));

        JsonNode rows = client.select(config.getAlertsRelation(), params, config.getPointReadTimeout());
        List<Alert> alerts = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            try {
                alerts.add(codec.toAlert(row));
            } catch (MalformedRecordException e) {
                LOG.warn("Skipping malformed alert row {}: {}", row.path("id").asText("?"), e.getMessage());
            }
        }
        return alerts;
    }
}
