package com.kpisentinel.analyzer.model;

import java.util.List;

public record SeasonalResult(List<Anomaly> anomalies, boolean seasonalityDetected, Trend trend) {

    private static final SeasonalResult NEUTRAL = new SeasonalResult(List.of(), false, Trend.STABLE);

    public SeasonalResult {
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        trend = trend == null ? Trend.STABLE : trend;
    }

    public static SeasonalResult neutral() {
        return NEUTRAL;
    }
}
