package com.kpisentinel.analyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single flagged point of a metric sequence. {@code score} is on the detecting method's own
 * scale; {@code deviationPct} is signed and measured against the baseline the method states in
 * its context.
 */
public record Anomaly(
        int index,
        double value,
        double score,
        DetectionMethod method,
        Severity severity,
        double deviationPct,
        Map<String, Object> context
) {
    public Anomaly {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(severity, "severity");
        if (score < 0) {
            throw new IllegalArgumentException("score must be non-negative");
        }
        context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
