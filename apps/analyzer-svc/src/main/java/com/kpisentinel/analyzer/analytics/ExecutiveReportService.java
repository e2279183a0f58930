package com.kpisentinel.analyzer.analytics;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.ExecutiveReport;
import com.kpisentinel.analyzer.model.MetricAnalysis;
import com.kpisentinel.analyzer.model.Severity;
import com.kpisentinel.analyzer.observability.ExecutionTracer;
import com.kpisentinel.analyzer.session.AnalysisNotFoundException;
import com.kpisentinel.analyzer.session.KpiSession;
import com.kpisentinel.analyzer.session.KpiSessionRepository;
import com.kpisentinel.analyzer.session.SessionChangedException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Compacts a session's analyses into an {@link ExecutiveReport}: metrics without anomalies are
 * left out and each metric keeps only its most severe anomalies.
 */
@Service
public class ExecutiveReportService {

    static final int TOP_ANOMALIES = 3;

    private final KpiSessionRepository sessionRepository;
    private final ExecutionTracer tracer;

    public ExecutiveReportService(KpiSessionRepository sessionRepository, ExecutionTracer tracer) {
        this.sessionRepository = sessionRepository;
        this.tracer = tracer;
    }

    public ExecutiveReport generate(String sessionId) {
        return tracer.trace("generate_executive_report", Map.of("session_id", sessionId), () -> doGenerate(sessionId));
    }

    private ExecutiveReport doGenerate(String sessionId) {
        KpiSession session = sessionRepository.require(sessionId);
        KpiSession.AnalysisRun run = session.run()
                .orElseThrow(() -> new AnalysisNotFoundException(sessionId));

        List<ExecutiveReport.MetricDigest> digests = new ArrayList<>();
        for (MetricAnalysis analysis : session.analyses().values()) {
            if (analysis.anomalies().isEmpty()) {
                continue;
            }
            digests.add(digest(analysis));
        }

        ExecutiveReport report = new ExecutiveReport(
                new ExecutiveReport.Metadata(
                        sessionId,
                        run.analyzedAt(),
                        session.cleaned().map(dataset -> dataset.rowCount()).orElse(0),
                        run.method(),
                        run.sensitivity()
                ),
                digests
        );
        sessionRepository.update(sessionId, current -> {
            if (current.lastRun() != run) {
                throw new SessionChangedException(sessionId, "analysis was replaced while the report was built");
            }
            return current.withReport(report);
        });
        return report;
    }

    private ExecutiveReport.MetricDigest digest(MetricAnalysis analysis) {
        List<Anomaly> bySeverity = new ArrayList<>(analysis.anomalies());
        bySeverity.sort(Comparator.comparingInt((Anomaly anomaly) -> anomaly.severity().rank()).reversed());
        List<ExecutiveReport.TopAnomaly> top = bySeverity.stream()
                .limit(TOP_ANOMALIES)
                .map(anomaly -> new ExecutiveReport.TopAnomaly(
                        round(anomaly.value(), 2),
                        round(anomaly.deviationPct(), 1),
                        anomaly.severity(),
                        anomaly.method(),
                        confidence(anomaly)
                ))
                .toList();
        return new ExecutiveReport.MetricDigest(
                analysis.metricName(),
                round(analysis.baselineMean(), 2),
                analysis.anomalies().size(),
                (int) analysis.countBySeverity(Severity.CRITICAL),
                analysis.trend(),
                analysis.seasonalityDetected(),
                analysis.correlationWith(),
                top
        );
    }

    private static double confidence(Anomaly anomaly) {
        if (anomaly.method() == DetectionMethod.ENSEMBLE && anomaly.context().get("confidence") instanceof Number number) {
            return number.doubleValue();
        }
        return 1.0d;
    }

    private static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
