package com.kpisentinel.analyzer.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Compacted view of a session's analyses, sized for hand-off to a reporting or summarising
 * collaborator. Only metrics that produced anomalies are listed.
 */
public record ExecutiveReport(Metadata metadata, List<MetricDigest> metrics) {

    public ExecutiveReport {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    public record Metadata(
            String sessionId,
            Instant analysisTime,
            int rowsAnalyzed,
            DetectionMethod method,
            Sensitivity sensitivity
    ) {
    }

    public record MetricDigest(
            String metric,
            double baselineMean,
            int totalAnomalies,
            int criticalCount,
            Trend trend,
            boolean seasonality,
            Map<String, Double> correlations,
            List<TopAnomaly> topAnomalies
    ) {
    }

    public record TopAnomaly(
            double value,
            double deviation,
            Severity severity,
            DetectionMethod method,
            double confidence
    ) {
    }
}
