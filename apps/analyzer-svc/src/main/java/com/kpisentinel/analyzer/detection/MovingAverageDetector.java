package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Gap from the trailing moving average, in standard deviations of all gaps. */
public final class MovingAverageDetector implements SingleMetricDetector {

    public static final int DEFAULT_WINDOW = 3;
    public static final double DEFAULT_THRESHOLD = 2.0d;

    private final int window;
    private final double threshold;

    public MovingAverageDetector() {
        this(DEFAULT_WINDOW, DEFAULT_THRESHOLD);
    }

    public MovingAverageDetector(int window, double threshold) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1");
        }
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("moving average threshold must be positive");
        }
        this.window = window;
        this.threshold = threshold;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.MOVING_AVERAGE;
    }

    @Override
    public List<Anomaly> detect(double[] values) {
        if (values.length < window || values.length == 0) {
            return List.of();
        }
        double[] movingAverage = trailingAverage(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - movingAverage[i]);
        }
        double deviationStd = SeriesStatistics.populationStd(deviations);
        if (deviationStd == 0 || !Double.isFinite(deviationStd)) {
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double score = deviations[i] / deviationStd;
            if (score > threshold) {
                anomalies.add(new Anomaly(
                        i,
                        values[i],
                        score,
                        DetectionMethod.MOVING_AVERAGE,
                        SeverityClassifier.classify(score, threshold),
                        SeriesStatistics.percentChange(values[i], movingAverage[i]),
                        Map.of("moving_avg", movingAverage[i], "window", window)
                ));
            }
        }
        return anomalies;
    }

    double[] trailingAverage(double[] values) {
        double[] averages = new double[values.length];
        for (int end = window - 1; end < values.length; end++) {
            double sum = 0;
            for (int i = end - window + 1; i <= end; i++) {
                sum += values[i];
            }
            averages[end] = sum / window;
        }
        for (int i = 0; i < window - 1; i++) {
            averages[i] = averages[window - 1];
        }
        return averages;
    }
}
