package com.kpisentinel.analyzer.analytics;

import com.kpisentinel.analyzer.detection.SeriesStatistics;
import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.MetricAnalysis;
import com.kpisentinel.analyzer.model.SeasonalResult;
import com.kpisentinel.analyzer.model.Trend;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Packages one metric's detector output into the immutable record handed to reporting. The
 * baseline is computed over the full sequence, outliers included.
 */
@Component
public class MetricAnalysisAssembler {

    public MetricAnalysis assemble(
            String metricName,
            double[] values,
            List<Anomaly> anomalies,
            List<DetectionMethod> methodsUsed,
            SeasonalResult seasonal,
            Map<String, Double> correlations
    ) {
        double mean = values.length == 0 ? 0d : SeriesStatistics.mean(values);
        double std = values.length == 0 ? 0d : SeriesStatistics.populationStd(values);
        boolean seasonality = seasonal != null && seasonal.seasonalityDetected();
        Trend trend = seasonal != null ? seasonal.trend() : Trend.STABLE;
        return new MetricAnalysis(
                metricName,
                mean,
                std,
                anomalies,
                methodsUsed.stream().map(DetectionMethod::label).toList(),
                seasonality,
                trend,
                correlations
        );
    }
}
