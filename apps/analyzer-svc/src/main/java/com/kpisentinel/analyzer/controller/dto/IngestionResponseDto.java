package com.kpisentinel.analyzer.controller.dto;

import java.time.Instant;
import java.util.List;

public record IngestionResponseDto(
        String status,
        String message,
        String sessionId,
        int rows,
        List<String> columns,
        List<String> numericColumns,
        boolean hasDateColumn,
        Instant ingestedAt,
        String traceId
) {
}
