package com.kpisentinel.analyzer.detection;

import com.kpisentinel.analyzer.model.Anomaly;
import com.kpisentinel.analyzer.model.DetectionMethod;
import java.util.List;

/**
 * A detector over one complete numeric sequence. Implementations hold only their parameters,
 * return an empty list for inputs they cannot judge, and never throw for short or degenerate
 * sequences.
 */
public interface SingleMetricDetector {

    DetectionMethod method();

    /** Anomalies ordered by ascending index. */
    List<Anomaly> detect(double[] values);
}
