package com.kpisentinel.analyzer.model;

import java.util.Locale;

public enum Sensitivity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Sensitivity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Sensitivity fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("sensitivity must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Sensitivity sensitivity : values()) {
            if (sensitivity.label.equals(normalized)) {
                return sensitivity;
            }
        }
        throw new IllegalArgumentException("Unknown sensitivity '" + value + "', expected low, medium or high");
    }
}
