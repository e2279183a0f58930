package com.kpisentinel.analyzer.observability;

import com.kpisentinel.analyzer.config.AnalyzerProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps a bounded, in-memory log of orchestration operations (ingest, analyze, report) and
 * derives simple execution metrics from it. The oldest traces are evicted first.
 */
@Component
public class ExecutionTracer {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracer.class);
    private static final int SUMMARY_LIMIT = 200;

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private final Deque<Trace> traces = new ConcurrentLinkedDeque<>();
    private final int maxTraces;
    private final Clock clock;

    @Autowired
    public ExecutionTracer(AnalyzerProperties properties) {
        this(properties.tracing().maxTraces(), Clock.systemUTC());
    }

    public ExecutionTracer(int maxTraces, Clock clock) {
        this.maxTraces = maxTraces;
        this.clock = clock;
    }

    /**
     * Runs {@code action}, recording its duration and outcome. Exceptions are recorded with
     * status {@code error} and rethrown unchanged.
     */
    public <T> T trace(String operation, Map<String, Object> arguments, Supplier<T> action) {
        long started = System.nanoTime();
        try {
            T result = action.get();
            record(operation, arguments, Duration.ofNanos(System.nanoTime() - started), STATUS_SUCCESS, String.valueOf(result));
            return result;
        } catch (RuntimeException ex) {
            record(operation, arguments, Duration.ofNanos(System.nanoTime() - started), STATUS_ERROR, ex.getMessage());
            throw ex;
        }
    }

    public Trace record(String operation, Map<String, Object> arguments, Duration duration, String status, String result) {
        Trace trace = new Trace(
                clock.instant(),
                operation,
                arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments)),
                duration,
                status,
                truncate(result),
                RequestContextHolder.currentTraceId()
        );
        traces.addLast(trace);
        while (traces.size() > maxTraces) {
            traces.pollFirst();
        }
        log.info("TOOL_CALL: {} | duration_ms={} | status={}", operation, duration.toMillis(), status);
        return trace;
    }

    public List<Trace> traces() {
        return List.copyOf(new ArrayList<>(traces));
    }

    public Metrics metrics() {
        List<Trace> snapshot = traces();
        if (snapshot.isEmpty()) {
            return new Metrics(0, Duration.ZERO, Duration.ZERO, Set.of(), 0d);
        }
        Duration total = snapshot.stream().map(Trace::duration).reduce(Duration.ZERO, Duration::plus);
        Set<String> operations = new TreeSet<>();
        long successes = 0;
        for (Trace trace : snapshot) {
            operations.add(trace.operation());
            if (STATUS_SUCCESS.equals(trace.status())) {
                successes++;
            }
        }
        return new Metrics(
                snapshot.size(),
                total,
                total.dividedBy(snapshot.size()),
                Collections.unmodifiableSet(operations),
                (double) successes / snapshot.size()
        );
    }

    public void clear() {
        traces.clear();
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= SUMMARY_LIMIT) {
            return value;
        }
        return value.substring(0, SUMMARY_LIMIT);
    }

    public record Trace(
            Instant timestamp,
            String operation,
            Map<String, Object> arguments,
            Duration duration,
            String status,
            String resultSummary,
            String requestTraceId
    ) {
    }

    public record Metrics(
            int totalCalls,
            Duration totalDuration,
            Duration averageDuration,
            Set<String> operationsUsed,
            double successRate
    ) {
    }
}
