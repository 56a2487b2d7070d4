package com.driftsentinel.core.source;

import com.driftsentinel.core.model.BaselineSnapshot;
import com.driftsentinel.core.model.MetricSnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Map-backed {@link MetricSource} for tests. Set {@link #failWith} to make
 * every read throw.
 */
public class InMemoryMetricSource implements MetricSource {

    private final TreeMap<LocalDate, MetricSnapshot> metrics = new TreeMap<>();
    private final Map<String, BaselineSnapshot> baselines = new HashMap<>();

    public RuntimeException failWith;
    public RuntimeException baselineFailure;

    public InMemoryMetricSource put(MetricSnapshot snapshot) {
        metrics.put(snapshot.getMetricDate(), snapshot);
        return this;
    }

    public InMemoryMetricSource put(BaselineSnapshot baseline) {
        baselines.put(baseline.getBaselineName(), baseline);
        return this;
    }

    @Override
    public Optional<MetricSnapshot> fetchMetric(LocalDate date) {
        maybeFail();
        return Optional.ofNullable(metrics.get(date));
    }

    @Override
    public List<MetricSnapshot> fetchMetricsSince(LocalDate since) {
        maybeFail();
        List<MetricSnapshot> result = new ArrayList<>(metrics.tailMap(since, true).values());
        result.sort(Comparator.comparing(MetricSnapshot::getMetricDate).reversed());
        return result;
    }

    @Override
    public Optional<BaselineSnapshot> fetchBaseline(String baselineName) {
        maybeFail();
        if (baselineFailure != null) {
            throw baselineFailure;
        }
        return Optional.ofNullable(baselines.get(baselineName));
    }

    private void maybeFail() {
        if (failWith != null) {
            throw failWith;
        }
    }
}
