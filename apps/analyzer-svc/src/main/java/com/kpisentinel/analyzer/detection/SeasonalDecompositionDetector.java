package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.SeasonalResult;
import com.kpisentinel.analyzer.model.Trend;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags points whose decomposition residual is unusually large, and reports the trend direction
 * and whether the sequence carries a seasonal pattern. Any failure inside the decomposition
 * yields {@link SeasonalResult#neutral()}.
 */
public final class SeasonalDecompositionDetector implements SingleMetricDetector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalDecompositionDetector.class);

    public static final int DEFAULT_PERIOD = 7;
    static final double RESIDUAL_THRESHOLD = 2.5d;
    static final double TREND_SLOPE_THRESHOLD = 0.01d;
    static final double SEASONAL_STRENGTH_THRESHOLD = 0.1d;
    private static final double NEGLIGIBLE_RESIDUAL = 1e-9d;

    private final int period;
    private final BiFunction<double[], Integer, SeasonalDecomposition> decomposer;

    public SeasonalDecompositionDetector() {
        this(DEFAULT_PERIOD);
    }

    public SeasonalDecompositionDetector(int period) {
        this(period, SeasonalDecomposition::additive);
    }

    SeasonalDecompositionDetector(int period, BiFunction<double[], Integer, SeasonalDecomposition> decomposer) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be at least 2");
        }
        this.period = period;
        this.decomposer = decomposer;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEASONAL;
    }

    @Override
    public List<Anomaly> detect(double[] values) {
        return analyse(values).anomalies();
    }

    public int minimumLength() {
        return 2 * period;
    }

    public SeasonalResult analyse(double[] values) {
        if (values.length < minimumLength()) {
            log.warn("Not enough data for seasonal decomposition: {} points, need {}", values.length, minimumLength());
            return SeasonalResult.neutral();
        }
        try {
            return evaluate(values);
        } catch (RuntimeException ex) {
            log.error("Seasonal decomposition failed for {} points with period {}: {}",
                    values.length, period, ex.getMessage(), ex);
            return SeasonalResult.neutral();
        }
    }

    private SeasonalResult evaluate(double[] values) {
        SeasonalDecomposition decomposition = decomposer.apply(values, period);
        double[] residual = decomposition.residual();
        double[] trend = decomposition.trend();
        double[] seasonal = decomposition.seasonal();

        Trend direction = trendDirection(trend);
        boolean seasonality = hasSeasonality(seasonal, values);

        double residualStd = SeriesStatistics.populationStd(finite(residual));
        double scale = Math.max(1d, Arrays.stream(values).map(Math::abs).max().orElse(0d));
        if (!Double.isFinite(residualStd) || residualStd <= NEGLIGIBLE_RESIDUAL * scale) {
            return new SeasonalResult(List.of(), seasonality, direction);
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(residual[i])) {
                continue;
            }
            double score = Math.abs(residual[i]) / residualStd;
            if (score > RESIDUAL_THRESHOLD) {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("residual", residual[i]);
                context.put("trend", Double.isNaN(trend[i]) ? null : trend[i]);
                context.put("seasonal", seasonal[i]);
                anomalies.add(new Anomaly(
                        i,
                        values[i],
                        score,
                        DetectionMethod.SEASONAL,
                        SeverityClassifier.classify(score, RESIDUAL_THRESHOLD),
                        values[i] == 0 ? 0d : residual[i] / values[i] * 100,
                        context
                ));
            }
        }
        return new SeasonalResult(anomalies, seasonality, direction);
    }

    private static Trend trendDirection(double[] trend) {
        double[] defined = finite(trend);
        if (defined.length < 2) {
            return Trend.STABLE;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < defined.length; i++) {
            regression.addData(i, defined[i]);
        }
        double slope = regression.getSlope();
        if (slope > TREND_SLOPE_THRESHOLD) {
            return Trend.INCREASING;
        }
        if (slope < -TREND_SLOPE_THRESHOLD) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    private static boolean hasSeasonality(double[] seasonal, double[] values) {
        double valuesStd = SeriesStatistics.populationStd(values);
        double seasonalStd = SeriesStatistics.populationStd(seasonal);
        if (!(valuesStd > 0) || !Double.isFinite(seasonalStd)) {
            return false;
        }
        return seasonalStd / valuesStd > SEASONAL_STRENGTH_THRESHOLD;
    }

    private static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }
}
