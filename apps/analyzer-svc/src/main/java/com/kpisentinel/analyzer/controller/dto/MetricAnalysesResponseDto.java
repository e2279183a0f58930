package com.kpisentinel.analyzer.controller.dto;

import java.util.List;
import java.util.Map;

public record MetricAnalysesResponseDto(String sessionId, List<MetricAnalysis> metrics, String traceId) {

    public record MetricAnalysis(
            String metricName,
            double baselineMean,
            double baselineStd,
            List<Anomaly> anomalies,
            List<String> detectionMethodsUsed,
            boolean seasonalityDetected,
            String trend,
            Map<String, Double> correlationWith
    ) {
    }

    public record Anomaly(
            int index,
            double value,
            double score,
            String method,
            String severity,
            double deviationPct,
            Map<String, Object> context
    ) {
    }
}
