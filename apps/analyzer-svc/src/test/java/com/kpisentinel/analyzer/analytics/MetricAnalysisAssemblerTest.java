package com.kpisentinel.analyzer.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.MetricAnalysis;
import com.kpisentinel.analyzer.model.SeasonalResult;
import com.kpisentinel.analyzer.model.Severity;
import com.kpisentinel.analyzer.model.Trend;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricAnalysisAssemblerTest {

    private final MetricAnalysisAssembler assembler = new MetricAnalysisAssembler();

    @Test
    void baselineCoversWholeSequence() {
        Anomaly spike = new Anomaly(3, 40, 2.5, DetectionMethod.Z_SCORE, Severity.LOW, 100, Map.of());

        MetricAnalysis analysis = assembler.assemble(
                "orders",
                new double[]{10, 10, 20, 40},
                List.of(spike),
                List.of(DetectionMethod.Z_SCORE),
                null,
                Map.of("revenue", 0.93));

        assertThat(analysis.metricName()).isEqualTo("orders");
        assertThat(analysis.baselineMean()).isCloseTo(20.0, within(1e-12));
        assertThat(analysis.baselineStd()).isCloseTo(Math.sqrt(150), within(1e-9));
        assertThat(analysis.anomalies()).containsExactly(spike);
        assertThat(analysis.detectionMethodsUsed()).containsExactly("z_score");
        assertThat(analysis.seasonalityDetected()).isFalse();
        assertThat(analysis.trend()).isEqualTo(Trend.STABLE);
        assertThat(analysis.correlationWith()).containsEntry("revenue", 0.93);
    }

    @Test
    void seasonalResultSuppliesTrendAndSeasonality() {
        MetricAnalysis analysis = assembler.assemble(
                "visits",
                new double[]{1, 2, 3},
                List.of(),
                List.of(DetectionMethod.SEASONAL),
                new SeasonalResult(List.of(), true, Trend.DECREASING),
                Map.of());

        assertThat(analysis.seasonalityDetected()).isTrue();
        assertThat(analysis.trend()).isEqualTo(Trend.DECREASING);
        assertThat(analysis.countBySeverity(Severity.CRITICAL)).isZero();
    }
}
