package com.kpisentinel.analyzer.model;

import java.util.Objects;

public record DetectionConfig(
        DetectionMethod method,
        Sensitivity sensitivity,
        boolean enableSeasonality,
        boolean enableMultivariate
) {
    public DetectionConfig {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(sensitivity, "sensitivity");
    }
}
