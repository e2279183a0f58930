package com.kpisentinel.analyzer.detection;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

public final class MultivariateCorrelator {

    public static final double DEFAULT_THRESHOLD = 0.7d;

    private final double threshold;

    public MultivariateCorrelator() {
        this(DEFAULT_THRESHOLD);
    }

    public MultivariateCorrelator(double threshold) {
        if (threshold < 0 || threshold >= 1) {
            throw new IllegalArgumentException("correlation threshold must be in [0, 1)");
        }
        this.threshold = threshold;
    }

    /** Columns in the table's iteration order; the target column is never part of the result. */
    public Map<String, Double> correlate(Map<String, double[]> table, String targetColumn) {
        double[] target = table.get(targetColumn);
        if (target == null || table.size() < 2 || target.length < 2) {
            return Map.of();
        }
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        Map<String, Double> correlations = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> column : table.entrySet()) {
            if (column.getKey().equals(targetColumn) || column.getValue().length != target.length) {
                continue;
            }
            double coefficient = pearson.correlation(target, column.getValue());
            if (Double.isFinite(coefficient) && Math.abs(coefficient) > threshold) {
                correlations.put(column.getKey(), coefficient);
            }
        }
        return correlations;
    }
}
