package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.SeasonalResult;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** One method per detection method. Holds no state. */
@Component
public class AnomalyDetectionEngine {

    public List<Anomaly> detectZScore(double[] values, double threshold) {
        return new ZScoreDetector(threshold).detect(values);
    }

    public List<Anomaly> detectIqr(double[] values, double multiplier) {
        return new IqrDetector(multiplier).detect(values);
    }

    public List<Anomaly> detectIsolationForest(double[] values, double contamination) {
        return new IsolationForestDetector(contamination).detect(values);
    }

    public List<Anomaly> detectMovingAverage(double[] values, int window, double threshold) {
        return new MovingAverageDetector(window, threshold).detect(values);
    }

    public SeasonalResult detectSeasonal(double[] values, int period) {
        return new SeasonalDecompositionDetector(period).analyse(values);
    }

    public Map<String, Double> detectMultivariate(Map<String, double[]> table, String targetColumn, double threshold) {
        return new MultivariateCorrelator(threshold).correlate(table, targetColumn);
    }

    public List<Anomaly> detectEnsemble(double[] values) {
        return detectEnsemble(values, EnsembleAggregator.DEFAULT_METHODS);
    }

    public List<Anomaly> detectEnsemble(double[] values, Set<DetectionMethod> methods) {
        return new EnsembleAggregator(methods).detect(values);
    }
}
