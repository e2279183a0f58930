package com.kpisentinel.analyzer.controller;

import com.kpisentinel.analyzer.analytics.ExecutiveReportService;
import com.kpisentinel.analyzer.analytics.KpiAnalysisService;
import com.kpisentinel.analyzer.config.AnalyzerProperties;
import com.kpisentinel.analyzer.controller.dto.AnalysisRequestDto;
import com.kpisentinel.analyzer.controller.dto.AnalysisSummaryResponseDto;
import com.kpisentinel.analyzer.controller.dto.ExecutiveReportResponseDto;
import com.kpisentinel.analyzer.controller.dto.IngestionResponseDto;
import com.kpisentinel.analyzer.controller.dto.MetricAnalysesResponseDto;
import com.kpisentinel.analyzer.ingest.IngestionResult;
import com.kpisentinel.analyzer.ingest.KpiIngestionService;
import com.kpisentinel.analyzer.model.AnalysisSummary;
import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionConfig;
import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.ExecutiveReport;
import com.kpisentinel.analyzer.model.MetricAnalysis;
import com.kpisentinel.analyzer.model.Sensitivity;
import com.kpisentinel.analyzer.observability.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sessions")
public class KpiSessionController {

    private final KpiIngestionService ingestionService;
    private final KpiAnalysisService analysisService;
    private final ExecutiveReportService reportService;
    private final AnalyzerProperties properties;

    public KpiSessionController(
            KpiIngestionService ingestionService,
            KpiAnalysisService analysisService,
            ExecutiveReportService reportService,
            AnalyzerProperties properties
    ) {
        this.ingestionService = ingestionService;
        this.analysisService = analysisService;
        this.reportService = reportService;
        this.properties = properties;
    }

    @PostMapping(path = "/{sessionId}/ingest", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<IngestionResponseDto> ingest(
            @PathVariable("sessionId") String sessionId,
            @RequestBody String csv
    ) {
        IngestionResult result = ingestionService.ingest(sessionId, csv);
        return ResponseEntity.ok(new IngestionResponseDto(
                "success",
                "Ingested " + result.rows() + " rows with " + result.numericColumns().size() + " numeric columns",
                result.sessionId(),
                result.rows(),
                result.columns(),
                result.numericColumns(),
                result.hasDateColumn(),
                result.ingestedAt(),
                RequestContextHolder.currentTraceId()
        ));
    }

    @PostMapping(path = "/{sessionId}/analysis")
    public ResponseEntity<AnalysisSummaryResponseDto> analyze(
            @PathVariable("sessionId") String sessionId,
            @Valid @RequestBody(required = false) AnalysisRequestDto request
    ) {
        DetectionConfig config = toConfig(request);
        AnalysisSummary summary = analysisService.analyze(sessionId, config);
        return ResponseEntity.ok(new AnalysisSummaryResponseDto(
                "success",
                "Detected " + summary.totalAnomalies() + " anomalies across " + summary.metricsAnalyzed() + " metrics",
                summary.totalAnomalies(),
                summary.criticalAnomalies(),
                summary.metricsAnalyzed(),
                summary.method().label(),
                summary.sensitivity().label(),
                RequestContextHolder.currentTraceId()
        ));
    }

    @GetMapping(path = "/{sessionId}/analysis")
    public ResponseEntity<MetricAnalysesResponseDto> analyses(@PathVariable("sessionId") String sessionId) {
        List<MetricAnalysesResponseDto.MetricAnalysis> metrics = analysisService.analyses(sessionId).values().stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new MetricAnalysesResponseDto(sessionId, metrics, RequestContextHolder.currentTraceId()));
    }

    @PostMapping(path = "/{sessionId}/report")
    public ResponseEntity<ExecutiveReportResponseDto> report(@PathVariable("sessionId") String sessionId) {
        ExecutiveReport report = reportService.generate(sessionId);
        ExecutiveReport.Metadata metadata = report.metadata();
        return ResponseEntity.ok(new ExecutiveReportResponseDto(
                new ExecutiveReportResponseDto.Metadata(
                        metadata.sessionId(),
                        metadata.analysisTime(),
                        metadata.rowsAnalyzed(),
                        metadata.method().label(),
                        metadata.sensitivity().label()
                ),
                report.metrics().stream().map(this::map).toList(),
                RequestContextHolder.currentTraceId()
        ));
    }

    private DetectionConfig toConfig(AnalysisRequestDto request) {
        AnalyzerProperties.Detection defaults = properties.detection();
        if (request == null) {
            return new DetectionConfig(defaults.defaultMethodValue(), defaults.defaultSensitivityValue(), true, true);
        }
        DetectionMethod method = request.method() == null
                ? defaults.defaultMethodValue()
                : DetectionMethod.fromLabel(request.method());
        Sensitivity sensitivity = request.sensitivity() == null
                ? defaults.defaultSensitivityValue()
                : Sensitivity.fromLabel(request.sensitivity());
        return new DetectionConfig(method, sensitivity, request.enableSeasonalityFlag(), request.enableMultivariateFlag());
    }

    private MetricAnalysesResponseDto.MetricAnalysis map(MetricAnalysis analysis) {
        return new MetricAnalysesResponseDto.MetricAnalysis(
                analysis.metricName(),
                analysis.baselineMean(),
                analysis.baselineStd(),
                analysis.anomalies().stream().map(this::map).toList(),
                analysis.detectionMethodsUsed(),
                analysis.seasonalityDetected(),
                analysis.trend().label(),
                analysis.correlationWith()
        );
    }

    private MetricAnalysesResponseDto.Anomaly map(Anomaly anomaly) {
        return new MetricAnalysesResponseDto.Anomaly(
                anomaly.index(),
                anomaly.value(),
                anomaly.score(),
                anomaly.method().label(),
                anomaly.severity().label(),
                anomaly.deviationPct(),
                anomaly.context()
        );
    }

    private ExecutiveReportResponseDto.MetricDigest map(ExecutiveReport.MetricDigest digest) {
        return new ExecutiveReportResponseDto.MetricDigest(
                digest.metric(),
                digest.baselineMean(),
                digest.totalAnomalies(),
                digest.criticalCount(),
                digest.trend().label(),
                digest.seasonality(),
                digest.correlations(),
                digest.topAnomalies().stream()
                        .map(top -> new ExecutiveReportResponseDto.TopAnomaly(
                                top.value(),
                                top.deviation(),
                                top.severity().label(),
                                top.method().label(),
                                top.confidence()))
                        .toList()
        );
    }
}
