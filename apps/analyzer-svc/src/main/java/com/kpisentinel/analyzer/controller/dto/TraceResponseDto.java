package com.kpisentinel.analyzer.controller.dto;

import java.time.Instant;
import java.util.Map;

public record TraceResponseDto(
        Instant timestamp,
        String operation,
        Map<String, Object> arguments,
        long durationMs,
        String status,
        String resultSummary,
        String requestTraceId
) {
}
