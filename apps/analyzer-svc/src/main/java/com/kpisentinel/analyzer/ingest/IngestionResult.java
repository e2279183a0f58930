package com.kpisentinel.analyzer.ingest;

import java.time.Instant;
import java.util.List;

public record IngestionResult(
        String sessionId,
        int rows,
        List<String> columns,
        List<String> numericColumns,
        boolean hasDateColumn,
        Instant ingestedAt
) {
}
