package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ZScoreDetector implements SingleMetricDetector {

    public static final double DEFAULT_THRESHOLD = 2.0d;

    private final double threshold;

    public ZScoreDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public ZScoreDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("z-score threshold must be positive");
        }
        this.threshold = threshold;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.Z_SCORE;
    }

    @Override
    public List<Anomaly> detect(double[] values) {
        if (values.length == 0) {
            return List.of();
        }
        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.populationStd(values);
        if (std == 0 || !Double.isFinite(std)) {
            return List.of();
        }
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double zScore = Math.abs(values[i] - mean) / std;
            if (zScore > threshold) {
                anomalies.add(new Anomaly(
                        i,
                        values[i],
                        zScore,
                        DetectionMethod.Z_SCORE,
                        SeverityClassifier.classify(zScore, threshold),
                        SeriesStatistics.percentChange(values[i], mean),
                        Map.of("mean", mean, "std", std)
                ));
            }
        }
        return anomalies;
    }
}
