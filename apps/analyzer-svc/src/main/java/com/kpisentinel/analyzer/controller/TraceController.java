package com.kpisentinel.analyzer.controller;

import com.kpisentinel.analyzer.controller.dto.TraceMetricsResponseDto;
import com.kpisentinel.analyzer.controller.dto.TraceResponseDto;
import com.kpisentinel.analyzer.observability.ExecutionTracer;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/traces")
public class TraceController {

    private final ExecutionTracer tracer;

    public TraceController(ExecutionTracer tracer) {
        this.tracer = tracer;
    }

    @GetMapping
    public ResponseEntity<List<TraceResponseDto>> traces() {
        List<TraceResponseDto> traces = tracer.traces().stream()
                .map(trace -> new TraceResponseDto(
                        trace.timestamp(),
                        trace.operation(),
                        trace.arguments(),
                        trace.duration().toMillis(),
                        trace.status(),
                        trace.resultSummary(),
                        trace.requestTraceId()))
                .toList();
        return ResponseEntity.ok(traces);
    }

    @GetMapping("/metrics")
    public ResponseEntity<TraceMetricsResponseDto> metrics() {
        ExecutionTracer.Metrics metrics = tracer.metrics();
        return ResponseEntity.ok(new TraceMetricsResponseDto(
                metrics.totalCalls(),
                metrics.totalDuration().toMillis(),
                metrics.averageDuration().toMillis(),
                metrics.operationsUsed(),
                metrics.successRate()
        ));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        tracer.clear();
        return ResponseEntity.noContent().build();
    }
}
