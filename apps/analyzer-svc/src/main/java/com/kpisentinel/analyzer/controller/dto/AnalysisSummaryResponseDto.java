package com.kpisentinel.analyzer.controller.dto;

public record AnalysisSummaryResponseDto(
        String status,
        String message,
        int totalAnomalies,
        int criticalAnomalies,
        int metricsAnalyzed,
        String method,
        String sensitivity,
        String traceId
) {
}
