package com.kpisentinel.analyzer.model;

public record AnalysisSummary(
        int totalAnomalies,
        int criticalAnomalies,
        int metricsAnalyzed,
        DetectionMethod method,
        Sensitivity sensitivity
) {
}
