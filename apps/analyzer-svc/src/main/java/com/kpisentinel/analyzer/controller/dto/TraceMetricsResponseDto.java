package com.kpisentinel.analyzer.controller.dto;

import java.util.Set;

public record TraceMetricsResponseDto(
        int totalCalls,
        long totalDurationMs,
        long averageDurationMs,
        Set<String> operationsUsed,
        double successRate
) {
}
