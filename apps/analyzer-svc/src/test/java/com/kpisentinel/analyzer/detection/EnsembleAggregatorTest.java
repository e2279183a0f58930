package com.kpisentinel.analyzer.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.Severity;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EnsembleAggregatorTest {

    @Test
    void keepsOnlyPointsWithQuorum() {
        double[] sales = {100, 105, 98, 300, 102, 99, 103, 101, 97, 500};

        List<Anomaly> anomalies = new EnsembleAggregator().detect(sales);

        assertThat(anomalies).extracting(Anomaly::index).containsExactly(9);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.method()).isEqualTo(DetectionMethod.ENSEMBLE);
        assertThat(anomaly.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.context())
                .containsEntry("votes", 3)
                .containsEntry("methods", List.of("z_score", "iqr", "moving_average"))
                .containsEntry("confidence", 1.0);
    }

    @Test
    void quorumIsAtLeastTwo() {
        assertThat(new EnsembleAggregator().quorum()).isEqualTo(2);
        assertThat(new EnsembleAggregator(EnumSet.of(DetectionMethod.Z_SCORE)).quorum()).isEqualTo(2);
        assertThat(new EnsembleAggregator(EnumSet.of(
                DetectionMethod.Z_SCORE,
                DetectionMethod.IQR,
                DetectionMethod.ISOLATION_FOREST,
                DetectionMethod.MOVING_AVERAGE,
                DetectionMethod.SEASONAL)).quorum()).isEqualTo(2);
    }

    @Test
    void singleMemberNeverReachesQuorum() {
        double[] values = {1, 1, 1, 1, 1, 1, 1, 1, 1, 90};

        assertThat(new EnsembleAggregator(EnumSet.of(DetectionMethod.Z_SCORE)).detect(values)).isEmpty();
    }

    @Test
    void resultIsSubsetOfConstituentFlags() {
        Random random = new Random(11);
        for (int round = 0; round < 25; round++) {
            double[] values = new double[40];
            for (int i = 0; i < values.length; i++) {
                values[i] = 50 + random.nextGaussian() * 5 + (random.nextInt(12) == 0 ? 60 : 0);
            }
            Set<Integer> union = new HashSet<>();
            new ZScoreDetector().detect(values).forEach(anomaly -> union.add(anomaly.index()));
            new IqrDetector().detect(values).forEach(anomaly -> union.add(anomaly.index()));
            new MovingAverageDetector().detect(values).forEach(anomaly -> union.add(anomaly.index()));

            List<Anomaly> ensemble = new EnsembleAggregator().detect(values);

            assertThat(ensemble).allSatisfy(anomaly -> {
                assertThat(union).contains(anomaly.index());
                assertThat((Integer) anomaly.context().get("votes")).isGreaterThanOrEqualTo(2);
            });
        }
    }

    @Test
    void isolationForestMemberIsSkippedOnShortSeries() {
        EnsembleAggregator aggregator = new EnsembleAggregator(EnumSet.of(
                DetectionMethod.Z_SCORE, DetectionMethod.IQR, DetectionMethod.ISOLATION_FOREST));
        double[] values = {10, 11, 10, 12, 11, 10, 60};

        List<Anomaly> anomalies = aggregator.detect(values);

        assertThat(anomalies).extracting(Anomaly::index).containsExactly(6);
        assertThat(anomalies.get(0).context()).containsEntry("confidence", 1.0);
    }

    @Test
    void rejectsCompositeMembers() {
        assertThatThrownBy(() -> new EnsembleAggregator(EnumSet.of(DetectionMethod.ENSEMBLE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EnsembleAggregator(EnumSet.of(DetectionMethod.MULTIVARIATE, DetectionMethod.IQR)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EnsembleAggregator(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
