package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags the {@code contamination} share of points with the lowest isolation scores. The forest is
 * seeded, so repeated calls over the same data agree.
 */
public final class IsolationForestDetector implements SingleMetricDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    public static final int MIN_POINTS = 10;
    public static final double DEFAULT_CONTAMINATION = 0.1d;
    public static final long DEFAULT_SEED = 42L;
    static final double SEVERITY_THRESHOLD = 1.0d;

    private final double contamination;
    private final long seed;

    public IsolationForestDetector() {
        this(DEFAULT_CONTAMINATION);
    }

    public IsolationForestDetector(double contamination) {
        this(contamination, DEFAULT_SEED);
    }

    public IsolationForestDetector(double contamination, long seed) {
        if (!(contamination > 0) || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5]");
        }
        this.contamination = contamination;
        this.seed = seed;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ISOLATION_FOREST;
    }

    @Override
    public List<Anomaly> detect(double[] values) {
        if (values.length < MIN_POINTS) {
            log.warn("Not enough data points for isolation forest: {} < {}", values.length, MIN_POINTS);
            return List.of();
        }
        IsolationForest forest = IsolationForest.fit(values, IsolationForest.DEFAULT_TREES, seed);
        double[] scores = forest.scoreSamples(values);
        double offset = SeriesStatistics.percentile(scores, contamination * 100);
        double mean = SeriesStatistics.mean(values);

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (scores[i] >= offset) {
                continue;
            }
            double score = -scores[i];
            anomalies.add(new Anomaly(
                    i,
                    values[i],
                    score,
                    DetectionMethod.ISOLATION_FOREST,
                    SeverityClassifier.classify(score, SEVERITY_THRESHOLD),
                    SeriesStatistics.percentChange(values[i], mean),
                    Map.of("isolation_score", scores[i])
            ));
        }
        return anomalies;
    }
}
