package com.kpisentinel.analyzer.model;

public enum Trend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
