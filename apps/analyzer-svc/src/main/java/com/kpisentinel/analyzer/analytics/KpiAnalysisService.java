package com.kpisentinel.analyzer.analytics;

import com.kpisentinel.analyzer.config.AnalyzerProperties;
import com.kpisentinel.analyzer.detection.AnomalyDetectionEngine;
import com.kpisentinel.analyzer.detection.MovingAverageDetector;
import com.kpisentinel.analyzer.model.AnalysisSummary;
import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionConfig;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.KpiDataset;
import com.kpisentinel.analyzer.model.MetricAnalysis;
import com.kpisentinel.analyzer.model.SeasonalResult;
import com.kpisentinel.analyzer.model.Severity;
import com.kpisentinel.analyzer.observability.ExecutionTracer;
import com.kpisentinel.analyzer.session.BaselineMemoryBank;
import com.kpisentinel.analyzer.session.KpiSession;
import com.kpisentinel.analyzer.session.KpiSessionRepository;
import com.kpisentinel.analyzer.session.SessionChangedException;
import com.kpisentinel.analyzer.session.SessionNotFoundException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the selected detection method over every numeric column of a session's cleaned dataset
 * and stores one {@link MetricAnalysis} per column back on the session.
 */
@Service
public class KpiAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(KpiAnalysisService.class);

    private final KpiSessionRepository sessionRepository;
    private final AnomalyDetectionEngine engine;
    private final MetricAnalysisAssembler assembler;
    private final BaselineMemoryBank memoryBank;
    private final ExecutionTracer tracer;
    private final AnalyzerProperties properties;

    public KpiAnalysisService(
            KpiSessionRepository sessionRepository,
            AnomalyDetectionEngine engine,
            MetricAnalysisAssembler assembler,
            BaselineMemoryBank memoryBank,
            ExecutionTracer tracer,
            AnalyzerProperties properties
    ) {
        this.sessionRepository = sessionRepository;
        this.engine = engine;
        this.assembler = assembler;
        this.memoryBank = memoryBank;
        this.tracer = tracer;
        this.properties = properties;
    }

    public AnalysisSummary analyze(String sessionId, DetectionConfig config) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("session_id", sessionId);
        arguments.put("method", config.method().label());
        arguments.put("sensitivity", config.sensitivity().label());
        return tracer.trace("analyze_kpi_deviations", arguments, () -> doAnalyze(sessionId, config));
    }

    public Map<String, MetricAnalysis> analyses(String sessionId) {
        return sessionRepository.require(sessionId).analyses();
    }

    private AnalysisSummary doAnalyze(String sessionId, DetectionConfig config) {
        KpiSession session = sessionRepository.require(sessionId);
        KpiDataset dataset = session.cleaned().orElseThrow(() -> new SessionNotFoundException(sessionId));
        AnalyzerProperties.Thresholds thresholds = properties.detection().thresholdsFor(config.sensitivity());
        int period = properties.detection().seasonalPeriod();

        Map<String, MetricAnalysis> analyses = new LinkedHashMap<>();
        for (String column : dataset.numericColumnNames()) {
            double[] values = dataset.values(column).orElseThrow();
            MetricAnalysis analysis = analyzeColumn(column, values, dataset, config, thresholds, period);
            analyses.put(column, analysis);
        }

        KpiSession.AnalysisRun run = new KpiSession.AnalysisRun(Instant.now(), config.method(), config.sensitivity());
        sessionRepository.update(sessionId, current -> {
            if (current.cleanedData() != dataset) {
                throw new SessionChangedException(sessionId, "data was re-ingested during analysis");
            }
            return current.withAnalyses(analyses, run);
        });
        analyses.values().forEach(analysis ->
                memoryBank.store(analysis.metricName(), analysis.baselineMean(), analysis.baselineStd()));

        int total = analyses.values().stream().mapToInt(analysis -> analysis.anomalies().size()).sum();
        int critical = (int) analyses.values().stream()
                .mapToLong(analysis -> analysis.countBySeverity(Severity.CRITICAL))
                .sum();
        log.info("Analysis session={} method={} sensitivity={} metrics={} anomalies={} critical={}",
                sessionId, config.method().label(), config.sensitivity().label(), analyses.size(), total, critical);
        return new AnalysisSummary(total, critical, analyses.size(), config.method(), config.sensitivity());
    }

    private MetricAnalysis analyzeColumn(
            String column,
            double[] values,
            KpiDataset dataset,
            DetectionConfig config,
            AnalyzerProperties.Thresholds thresholds,
            int period
    ) {
        SeasonalResult seasonal = null;
        List<Anomaly> anomalies = switch (config.method()) {
            case Z_SCORE -> engine.detectZScore(values, thresholds.z());
            case IQR -> engine.detectIqr(values, thresholds.iqr());
            case ISOLATION_FOREST -> engine.detectIsolationForest(values, thresholds.isolation());
            case MOVING_AVERAGE -> engine.detectMovingAverage(values,
                    MovingAverageDetector.DEFAULT_WINDOW, MovingAverageDetector.DEFAULT_THRESHOLD);
            case SEASONAL -> {
                seasonal = engine.detectSeasonal(values, period);
                yield seasonal.anomalies();
            }
            case MULTIVARIATE, ENSEMBLE -> engine.detectEnsemble(values);
        };

        if (config.enableSeasonality() && seasonal == null && values.length >= 2 * period) {
            seasonal = engine.detectSeasonal(values, period);
        }

        Map<String, Double> correlations = Map.of();
        if (config.enableMultivariate() || config.method() == DetectionMethod.MULTIVARIATE) {
            correlations = engine.detectMultivariate(dataset.numericColumns(), column,
                    properties.detection().correlationThreshold());
        }

        return assembler.assemble(column, values, anomalies, List.of(config.method()), seasonal, correlations);
    }
}
