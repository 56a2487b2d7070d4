package com.driftsentinel.rest;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertStatus;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;
import com.driftsentinel.core.model.ThresholdConfig;
import com.driftsentinel.core.source.MalformedRecordException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Maps between store rows (JSON) and the domain model.
 *
 * <h3>Row conventions</h3>
 * <ul>
 * <li>Metric rows use the snapshot's field names; missing or {@code null}
 * numbers read as zero.</li>
 * <li>Baseline rows prefix every value column with {@code baseline_}, and
 * carry the window as {@code baseline_window_days} (default 7).</li>
 * <li>An infinite {@code deviation_ratio} is written as the string
 * {@code "Infinity"}; both that string and plain numbers are accepted on
 * read.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class RecordCodec {

    private static final Logger LOG = LoggerFactory.getLogger(RecordCodec.class);

    static final String INFINITY = "Infinity";

    private static final TypeReference<Map<String, Object>> CONTEXT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public RecordCodec() {
        this(objectMapper());
    }

    RecordCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @return a mapper configured for store payloads: Java time support, ISO
     *         dates, unknown properties ignored
     */
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    // ---------------------------------------------------------------
    // Rows -> model
    // ---------------------------------------------------------------

    /**
     * @throws MalformedRecordException if {@code metric_date} is missing or
     *                                  unparseable
     */
    public MetricSnapshot toMetricSnapshot(JsonNode row) {
        return MetricSnapshot.builder()
                .metricDate(requireDate(row, "metric_date"))
                .totalEvents(readLong(row, "total_events"))
                .successfulEvents(readLong(row, "successful_events"))
                .failedEvents(readLong(row, "failed_events"))
                .fallbackEvents(readLong(row, "fallback_events"))
                .duplicateEvents(readLong(row, "duplicate_events"))
                .fallbackRate(readDouble(row, "fallback_rate"))
                .errorRate(readDouble(row, "error_rate"))
                .duplicateRate(readDouble(row, "duplicate_rate"))
                .latencyP50(readDouble(row, "latency_p50"))
                .latencyP95(readDouble(row, "latency_p95"))
                .latencyP99(readDouble(row, "latency_p99"))
                .healthScore(readDouble(row, "health_score"))
                .build();
    }

    /**
     * @throws MalformedRecordException if the row fails baseline validation
     */
    public BaselineSnapshot toBaselineSnapshot(JsonNode row) {
        try {
            return BaselineSnapshot.builder()
                    .baselineName(readText(row, "baseline_name"))
                    .windowDays(row.hasNonNull("baseline_window_days")
                            ? row.get("baseline_window_days").asInt()
                            : 7)
                    .fallbackRate(readDouble(row, "baseline_fallback_rate"))
                    .errorRate(readDouble(row, "baseline_error_rate"))
                    .duplicateRate(readDouble(row, "baseline_duplicate_rate"))
                    .latencyP50(readDouble(row, "baseline_latency_p50"))
                    .latencyP95(readDouble(row, "baseline_latency_p95"))
                    .latencyP99(readDouble(row, "baseline_latency_p99"))
                    .validUntil(readText(row, "valid_until"))
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new MalformedRecordException("Malformed baseline row: " + e.getMessage(), e);
        }
    }

    /**
     * Read a stored alert. An unknown or missing severity reads as
     * {@link AlertSeverity#LOW}.
     *
     * @throws MalformedRecordException if the type, status, metric name or
     *                                  metric date is missing or unknown
     */
    public Alert toAlert(JsonNode row) {
        String typeName = readText(row, "alert_type");
        AlertType type = AlertType.fromValue(typeName)
                .orElseThrow(() -> new MalformedRecordException("Unknown alert_type: " + typeName, null));
        String statusName = readText(row, "status");
        AlertStatus status = AlertStatus.fromValue(statusName)
                .orElseThrow(() -> new MalformedRecordException("Unknown alert status: " + statusName, null));
        String severityName = readText(row, "severity");
        AlertSeverity severity = AlertSeverity.fromValue(severityName).orElseGet(() -> {
            LOG.debug("Alert row has unknown severity '{}', ranking it as low", severityName);
            return AlertSeverity.LOW;
        });
        String metricName = readText(row, "metric_name");
        if (metricName == null) {
            throw new MalformedRecordException("Alert row is missing metric_name", null);
        }

        return Alert.builder()
                .id(readText(row, "id"))
                .alertType(type)
                .severity(severity)
                .metricName(metricName)
                .currentValue(readDouble(row, "current_value"))
                .baselineValue(readDouble(row, "baseline_value"))
                .deviationRatio(readDouble(row, "deviation_ratio"))
                .thresholds(readThresholds(row))
                .metricDate(requireDate(row, "metric_date"))
                .comparisonWindowDays(row.path("comparison_window_days").asInt(7))
                .affectedModel(readText(row, "affected_model"))
                .affectedBackend(readText(row, "affected_backend"))
                .affectedAgent(readText(row, "affected_agent"))
                .context(readContext(row))
                .status(status)
                .createdAt(readInstant(row, "created_at"))
                .build();
    }

    // ---------------------------------------------------------------
    // Model -> rows
    // ---------------------------------------------------------------

    /**
     * Build the insert payload for a newly detected alert. Status is always
     * {@code open}.
     */
    public ObjectNode toAlertPayload(Alert alert) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("alert_type", alert.getAlertType().getValue());
        payload.put("severity", alert.getSeverity().getValue());
        payload.put("metric_name", alert.getMetricName());
        payload.put("current_value", alert.getCurrentValue());
        payload.put("baseline_value", alert.getBaselineValue());
        if (alert.isBaselineZero()) {
            payload.put("deviation_ratio", INFINITY);
        } else {
            payload.put("deviation_ratio", alert.getDeviationRatio());
        }
        ThresholdConfig thresholds = alert.getThresholds();
        if (thresholds != null) {
            payload.put("threshold_low", thresholds.getLow());
            payload.put("threshold_medium", thresholds.getMedium());
            payload.put("threshold_high", thresholds.getHigh());
        } else {
            payload.putNull("threshold_low");
            payload.putNull("threshold_medium");
            payload.putNull("threshold_high");
        }
        payload.put("metric_date", alert.getMetricDate().toString());
        payload.put("comparison_window_days", alert.getComparisonWindowDays());
        payload.put("affected_model", alert.getAffectedModel());
        payload.put("affected_backend", alert.getAffectedBackend());
        payload.put("affected_agent", alert.getAffectedAgent());
        payload.set("context_data", mapper.valueToTree(alert.getContext()));
        payload.put("status", AlertStatus.OPEN.getValue());
        return payload;
    }

    // ---------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------

    static double readDouble(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if (INFINITY.equalsIgnoreCase(text) || "+Infinity".equalsIgnoreCase(text)) {
                return Double.POSITIVE_INFINITY;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new MalformedRecordException("Field '" + field + "' is not numeric: " + text, e);
            }
        }
        throw new MalformedRecordException("Field '" + field + "' is not numeric: " + node, null);
    }

    private static long readLong(JsonNode row, String field) {
        JsonNode node = row.get(field);
        return node == null || node.isNull() ? 0 : node.asLong();
    }

    private static String readText(JsonNode row, String field) {
        JsonNode node = row.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static LocalDate requireDate(JsonNode row, String field) {
        String text = readText(row, field);
        if (text == null) {
            throw new MalformedRecordException("Row is missing " + field, null);
        }
        try {
            // timestamp columns arrive as full ISO date-times
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("Unparseable " + field + ": " + text, e);
        }
    }

    private static Instant readInstant(JsonNode row, String field) {
        String text = readText(row, field);
        if (text == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring unparseable {} '{}'", field, text);
            return null;
        }
    }

    private static ThresholdConfig readThresholds(JsonNode row) {
        if (!row.hasNonNull("threshold_low") || !row.hasNonNull("threshold_medium")
                || !row.hasNonNull("threshold_high")) {
            return null;
        }
        try {
            return new ThresholdConfig(readDouble(row, "threshold_low"),
                    readDouble(row, "threshold_medium"),
                    readDouble(row, "threshold_high"));
        } catch (IllegalArgumentException e) {
            LOG.debug("Ignoring invalid stored thresholds: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Object> readContext(JsonNode row) {
        JsonNode node = row.get("context_data");
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, CONTEXT_TYPE);
    }
}
