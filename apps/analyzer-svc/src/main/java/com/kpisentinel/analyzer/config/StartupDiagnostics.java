package com.kpisentinel.analyzer.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final AnalyzerProperties props;

    public StartupDiagnostics(AnalyzerProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var detection = props.detection();
        log.info("Detection config: defaultMethod='{}', defaultSensitivity='{}', seasonalPeriod={}, correlationThreshold={}",
                detection.defaultMethod(), detection.defaultSensitivity(), detection.seasonalPeriod(),
                detection.correlationThreshold());
        detection.sensitivity().forEach((tier, thresholds) ->
                log.info("Sensitivity '{}': z={}, iqr={}, isolation={}",
                        tier, thresholds.z(), thresholds.iqr(), thresholds.isolation()));
        log.info("Ingest config: maxDataPoints={}; tracing: maxTraces={}",
                props.ingest().maxDataPoints(), props.tracing().maxTraces());
    }
}
