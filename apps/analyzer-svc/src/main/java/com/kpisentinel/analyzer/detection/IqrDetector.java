package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Tukey fences; deviation is measured against the median. */
public final class IqrDetector implements SingleMetricDetector {

    public static final double DEFAULT_MULTIPLIER = 1.5d;

    private final double multiplier;

    public IqrDetector() {
        this(DEFAULT_MULTIPLIER);
    }

    public IqrDetector(double multiplier) {
        if (!(multiplier > 0)) {
            throw new IllegalArgumentException("IQR multiplier must be positive");
        }
        this.multiplier = multiplier;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.IQR;
    }

    @Override
    public List<Anomaly> detect(double[] values) {
        if (values.length == 0) {
            return List.of();
        }
        double q1 = SeriesStatistics.percentile(values, 25);
        double q3 = SeriesStatistics.percentile(values, 75);
        double iqr = q3 - q1;
        if (iqr == 0 || !Double.isFinite(iqr)) {
            return List.of();
        }
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;
        double median = SeriesStatistics.median(values);

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value >= lowerBound && value <= upperBound) {
                continue;
            }
            double score = value < lowerBound
                    ? (lowerBound - value) / iqr
                    : (value - upperBound) / iqr;
            anomalies.add(new Anomaly(
                    i,
                    value,
                    score,
                    DetectionMethod.IQR,
                    SeverityClassifier.classify(score, multiplier),
                    SeriesStatistics.percentChange(value, median),
                    Map.of("q1", q1, "q3", q3, "iqr", iqr)
            ));
        }
        return anomalies;
    }
}
