package com.kpisentinel.analyzer.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.SeasonalResult;
import com.kpisentinel.analyzer.model.Trend;
import org.junit.jupiter.api.Test;

class SeasonalDecompositionDetectorTest {

    private static final double[] WEEK = {10, 12, 15, 20, 18, 14, 11};

    private final SeasonalDecompositionDetector detector = new SeasonalDecompositionDetector(7);

    @Test
    void noiseFreeWeeklyPatternIsSeasonalAndStable() {
        SeasonalResult result = detector.analyse(repeat(WEEK, 3));

        assertThat(result.seasonalityDetected()).isTrue();
        assertThat(result.trend()).isEqualTo(Trend.STABLE);
        assertThat(result.anomalies()).isEmpty();
    }

    @Test
    void linearGrowthIsReportedAsIncreasing() {
        double[] values = repeat(WEEK, 3);
        for (int i = 0; i < values.length; i++) {
            values[i] += 2 * i;
        }

        assertThat(detector.analyse(values).trend()).isEqualTo(Trend.INCREASING);
    }

    @Test
    void linearDeclineIsReportedAsDecreasing() {
        double[] values = repeat(WEEK, 3);
        for (int i = 0; i < values.length; i++) {
            values[i] += 200 - 3 * i;
        }

        assertThat(detector.analyse(values).trend()).isEqualTo(Trend.DECREASING);
    }

    @Test
    void flagsSpikeInResidual() {
        double[] values = repeat(WEEK, 4);
        values[17] += 50;

        SeasonalResult result = detector.analyse(values);

        assertThat(result.anomalies()).extracting(Anomaly::index).containsExactly(17);
        Anomaly anomaly = result.anomalies().get(0);
        assertThat(anomaly.method()).isEqualTo(DetectionMethod.SEASONAL);
        assertThat(anomaly.context()).containsKeys("residual", "trend", "seasonal");
        assertThat(anomaly.deviationPct()).isPositive();
    }

    @Test
    void shortSequenceIsNeutral() {
        SeasonalResult result = detector.analyse(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13});

        assertThat(result).isEqualTo(SeasonalResult.neutral());
        assertThat(detector.detect(new double[]{1, 2, 3})).isEmpty();
    }

    @Test
    void decompositionFailureYieldsNeutralResult() {
        SeasonalDecompositionDetector failing = new SeasonalDecompositionDetector(7, (values, period) -> {
            throw new ArithmeticException("singular fit");
        });

        SeasonalResult result = failing.analyse(repeat(WEEK, 3));

        assertThat(result).isEqualTo(SeasonalResult.neutral());
        assertThat(failing.detect(repeat(WEEK, 3))).isEmpty();
    }

    @Test
    void malformedComponentsYieldNeutralResult() {
        SeasonalDecompositionDetector truncated = new SeasonalDecompositionDetector(7, (values, period) ->
                new SeasonalDecomposition(new double[]{1, 2}, new double[]{0, 0}, new double[]{5, -5}));

        assertThat(truncated.analyse(repeat(WEEK, 3))).isEqualTo(SeasonalResult.neutral());
    }

    @Test
    void evenPeriodDecomposesWithoutFailure() {
        double[] values = repeat(new double[]{5, 9, 7, 3}, 5);

        SeasonalResult result = new SeasonalDecompositionDetector(4).analyse(values);

        assertThat(result.seasonalityDetected()).isTrue();
        assertThat(result.trend()).isEqualTo(Trend.STABLE);
    }

    private static double[] repeat(double[] pattern, int times) {
        double[] values = new double[pattern.length * times];
        for (int i = 0; i < values.length; i++) {
            values[i] = pattern[i % pattern.length];
        }
        return values;
    }
}
