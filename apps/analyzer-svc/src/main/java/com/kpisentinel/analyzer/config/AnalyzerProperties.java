package com.kpisentinel.analyzer.config;

import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.Sensitivity;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "kpi")
public record AnalyzerProperties(
        Detection detection,
        Ingest ingest,
        Tracing tracing
) {

    @ConstructorBinding
    public AnalyzerProperties {
        detection = detection != null ? detection : new Detection(null, null, null, null, null);
        ingest = ingest != null ? ingest : new Ingest(null);
        tracing = tracing != null ? tracing : new Tracing(null);
    }

    public static AnalyzerProperties defaults() {
        return new AnalyzerProperties(null, null, null);
    }

    public record Detection(
            String defaultMethod,
            String defaultSensitivity,
            Integer seasonalPeriod,
            Double correlationThreshold,
            Map<String, Thresholds> sensitivity
    ) {
        public Detection {
            if (defaultMethod == null || defaultMethod.isBlank()) {
                defaultMethod = DetectionMethod.ENSEMBLE.label();
            }
            // unknown labels are rejected at bind time
            DetectionMethod.fromLabel(defaultMethod);
            if (defaultSensitivity == null || defaultSensitivity.isBlank()) {
                defaultSensitivity = Sensitivity.MEDIUM.label();
            }
            Sensitivity.fromLabel(defaultSensitivity);
            if (seasonalPeriod == null) {
                seasonalPeriod = 7;
            }
            if (seasonalPeriod < 2) {
                throw new IllegalArgumentException("seasonalPeriod must be at least 2");
            }
            if (correlationThreshold == null) {
                correlationThreshold = 0.7d;
            }
            if (correlationThreshold < 0 || correlationThreshold >= 1) {
                throw new IllegalArgumentException("correlationThreshold must be in [0, 1)");
            }
            Map<String, Thresholds> merged = new LinkedHashMap<>(defaultThresholds());
            if (sensitivity != null) {
                sensitivity.forEach((tier, thresholds) ->
                        merged.put(Sensitivity.fromLabel(tier).label(), thresholds));
            }
            sensitivity = Map.copyOf(merged);
        }

        public DetectionMethod defaultMethodValue() {
            return DetectionMethod.fromLabel(defaultMethod);
        }

        public Sensitivity defaultSensitivityValue() {
            return Sensitivity.fromLabel(defaultSensitivity);
        }

        public Thresholds thresholdsFor(Sensitivity tier) {
            return sensitivity.get(tier.label());
        }

        private static Map<String, Thresholds> defaultThresholds() {
            Map<String, Thresholds> defaults = new LinkedHashMap<>();
            defaults.put(Sensitivity.LOW.label(), new Thresholds(3.0d, 2.0d, 0.05d));
            defaults.put(Sensitivity.MEDIUM.label(), new Thresholds(2.0d, 1.5d, 0.1d));
            defaults.put(Sensitivity.HIGH.label(), new Thresholds(1.5d, 1.2d, 0.15d));
            return defaults;
        }
    }

    /**
     * Per-tier detector thresholds: {@code z} for the z-score detector, {@code iqr} for the IQR
     * multiplier and {@code isolation} for the isolation forest contamination.
     */
    public record Thresholds(double z, double iqr, double isolation) {
        public Thresholds {
            if (z <= 0) {
                throw new IllegalArgumentException("z threshold must be positive");
            }
            if (iqr <= 0) {
                throw new IllegalArgumentException("iqr multiplier must be positive");
            }
            if (isolation <= 0 || isolation > 0.5) {
                throw new IllegalArgumentException("isolation contamination must be in (0, 0.5]");
            }
        }
    }

    public record Ingest(Integer maxDataPoints) {
        public Ingest {
            if (maxDataPoints == null) {
                maxDataPoints = 10_000;
            }
            if (maxDataPoints <= 0) {
                throw new IllegalArgumentException("maxDataPoints must be positive");
            }
        }
    }

    public record Tracing(Integer maxTraces) {
        public Tracing {
            if (maxTraces == null) {
                maxTraces = 1_000;
            }
            if (maxTraces <= 0) {
                throw new IllegalArgumentException("maxTraces must be positive");
            }
        }
    }
}
