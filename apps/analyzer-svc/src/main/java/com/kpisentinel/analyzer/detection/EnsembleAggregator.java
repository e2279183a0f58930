package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs several single-metric detectors with their default parameters and keeps only the indices
 * that enough of them agree on. The quorum is {@code max(2, floor(selected / 2))}, so a point
 * flagged by a single detector never survives.
 */
public final class EnsembleAggregator {

    public static final Set<DetectionMethod> DEFAULT_METHODS =
            Set.copyOf(EnumSet.of(DetectionMethod.Z_SCORE, DetectionMethod.IQR, DetectionMethod.MOVING_AVERAGE));
    static final double SEVERITY_THRESHOLD = 2.0d;
    private static final int MIN_QUORUM = 2;

    private final Set<DetectionMethod> methods;

    public EnsembleAggregator() {
        this(DEFAULT_METHODS);
    }

    public EnsembleAggregator(Set<DetectionMethod> methods) {
        if (methods == null || methods.isEmpty()) {
            throw new IllegalArgumentException("ensemble needs at least one method");
        }
        for (DetectionMethod method : methods) {
            if (method == DetectionMethod.ENSEMBLE || method == DetectionMethod.MULTIVARIATE) {
                throw new IllegalArgumentException("'" + method.label() + "' cannot be an ensemble member");
            }
        }
        this.methods = EnumSet.copyOf(methods);
    }

    public int quorum() {
        return Math.max(MIN_QUORUM, methods.size() / 2);
    }

    public List<Anomaly> detect(double[] values) {
        List<SingleMetricDetector> detectors = detectorsFor(values.length);
        Map<Integer, List<Anomaly>> votes = new TreeMap<>();
        for (SingleMetricDetector detector : detectors) {
            for (Anomaly anomaly : detector.detect(values)) {
                votes.computeIfAbsent(anomaly.index(), index -> new ArrayList<>()).add(anomaly);
            }
        }

        int quorum = quorum();
        List<Anomaly> survivors = new ArrayList<>();
        for (Map.Entry<Integer, List<Anomaly>> entry : votes.entrySet()) {
            List<Anomaly> details = entry.getValue();
            if (details.size() < quorum) {
                continue;
            }
            double averageScore = details.stream().mapToDouble(Anomaly::score).average().orElse(0d);
            List<String> contributing = details.stream().map(anomaly -> anomaly.method().label()).toList();
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("votes", details.size());
            context.put("methods", contributing);
            context.put("confidence", (double) details.size() / detectors.size());
            int index = entry.getKey();
            survivors.add(new Anomaly(
                    index,
                    values[index],
                    averageScore,
                    DetectionMethod.ENSEMBLE,
                    SeverityClassifier.classify(averageScore, SEVERITY_THRESHOLD),
                    details.get(0).deviationPct(),
                    context
            ));
        }
        return survivors;
    }

    private List<SingleMetricDetector> detectorsFor(int length) {
        List<SingleMetricDetector> detectors = new ArrayList<>();
        for (DetectionMethod method : methods) {
            switch (method) {
                case Z_SCORE -> detectors.add(new ZScoreDetector());
                case IQR -> detectors.add(new IqrDetector());
                case MOVING_AVERAGE -> detectors.add(new MovingAverageDetector());
                case ISOLATION_FOREST -> {
                    if (length >= IsolationForestDetector.MIN_POINTS) {
                        detectors.add(new IsolationForestDetector());
                    }
                }
                case SEASONAL -> detectors.add(new SeasonalDecompositionDetector());
                case MULTIVARIATE, ENSEMBLE -> throw new IllegalStateException("not a single-metric method: " + method);
            }
        }
        return detectors;
    }
}
