package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Severity;

public final class SeverityClassifier {

    private static final double CRITICAL_FACTOR = 3.0d;
    private static final double HIGH_FACTOR = 2.0d;
    private static final double MEDIUM_FACTOR = 1.5d;

    private SeverityClassifier() {
    }

    public static Severity classify(double score, double threshold) {
        if (score > threshold * CRITICAL_FACTOR) {
            return Severity.CRITICAL;
        }
        if (score > threshold * HIGH_FACTOR) {
            return Severity.HIGH;
        }
        if (score > threshold * MEDIUM_FACTOR) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
