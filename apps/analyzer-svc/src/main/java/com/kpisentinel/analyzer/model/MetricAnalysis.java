package com.kpisentinel.analyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record MetricAnalysis(
        String metricName,
        double baselineMean,
        double baselineStd,
        List<Anomaly> anomalies,
        List<String> detectionMethodsUsed,
        boolean seasonalityDetected,
        Trend trend,
        Map<String, Double> correlationWith
) {
    public MetricAnalysis {
        Objects.requireNonNull(metricName, "metricName");
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        detectionMethodsUsed = detectionMethodsUsed == null ? List.of() : List.copyOf(detectionMethodsUsed);
        trend = trend == null ? Trend.STABLE : trend;
        correlationWith = correlationWith == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(correlationWith));
    }

    public long countBySeverity(Severity severity) {
        return anomalies.stream().filter(anomaly -> anomaly.severity() == severity).count();
    }
}
