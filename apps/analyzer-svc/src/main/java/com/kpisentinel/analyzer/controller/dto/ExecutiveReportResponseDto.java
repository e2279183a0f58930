package com.kpisentinel.analyzer.controller.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ExecutiveReportResponseDto(Metadata metadata, List<MetricDigest> metrics, String traceId) {

    public record Metadata(
            String sessionId,
            Instant analysisTime,
            int rowsAnalyzed,
            String method,
            String sensitivity
    ) {
    }

    public record MetricDigest(
            String metric,
            double baselineMean,
            int totalAnomalies,
            int criticalCount,
            String trend,
            boolean seasonality,
            Map<String, Double> correlations,
            List<TopAnomaly> topAnomalies
    ) {
    }

    public record TopAnomaly(double value, double deviation, String severity, String method, double confidence) {
    }
}
