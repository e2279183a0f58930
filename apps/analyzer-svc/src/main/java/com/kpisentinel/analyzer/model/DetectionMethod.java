package com.kpisentinel.analyzer.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The closed set of detection methods a caller can select. Dispatch over this enum is done
 * with exhaustive {@code switch} expressions so that adding a method fails compilation at
 * every call site that does not handle it.
 */
public enum DetectionMethod {
    Z_SCORE("z_score"),
    IQR("iqr"),
    ISOLATION_FOREST("isolation_forest"),
    MOVING_AVERAGE("moving_average"),
    SEASONAL("seasonal"),
    MULTIVARIATE("multivariate"),
    ENSEMBLE("ensemble");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DetectionMethod fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("method must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DetectionMethod method : values()) {
            if (method.label.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method '" + value + "', expected one of "
                + Arrays.stream(values()).map(DetectionMethod::label).collect(Collectors.joining(", ")));
    }
}
