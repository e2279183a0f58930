package com.kpisentinel.analyzer.session;

import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.ExecutiveReport;
import com.kpisentinel.analyzer.model.KpiDataset;
import com.kpisentinel.analyzer.model.MetricAnalysis;
import com.kpisentinel.analyzer.model.Sensitivity;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one analysis session. Each stage returns a new instance; a fresh ingestion discards
 * analyses and reports computed from a previous upload.
 */
public record KpiSession(
        String sessionId,
        KpiDataset rawData,
        KpiDataset cleanedData,
        Instant ingestedAt,
        Map<String, MetricAnalysis> analyses,
        AnalysisRun lastRun,
        ExecutiveReport report
) {
    public KpiSession {
        Objects.requireNonNull(sessionId, "sessionId");
        analyses = analyses == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(analyses));
    }

    public static KpiSession ingested(String sessionId, KpiDataset rawData, KpiDataset cleanedData, Instant ingestedAt) {
        return new KpiSession(sessionId, rawData, cleanedData, ingestedAt, Map.of(), null, null);
    }

    public KpiSession withAnalyses(Map<String, MetricAnalysis> analyses, AnalysisRun run) {
        return new KpiSession(sessionId, rawData, cleanedData, ingestedAt, analyses, run, null);
    }

    public KpiSession withReport(ExecutiveReport report) {
        return new KpiSession(sessionId, rawData, cleanedData, ingestedAt, analyses, lastRun, report);
    }

    public Optional<KpiDataset> cleaned() {
        return Optional.ofNullable(cleanedData);
    }

    public Optional<AnalysisRun> run() {
        return Optional.ofNullable(lastRun);
    }

    public record AnalysisRun(Instant analyzedAt, DetectionMethod method, Sensitivity sensitivity) {
    }
}
