package com.kpisentinel.analyzer.session;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Remembers each metric's baseline per calendar month under {@code baseline_<metric>_<yyyyMM>}.
 * A later analysis in the same month overwrites the entry.
 */
@Component
public class BaselineMemoryBank {

    private static final Logger log = LoggerFactory.getLogger(BaselineMemoryBank.class);
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyyMM");

    private final ConcurrentMap<String, Baseline> baselines = new ConcurrentHashMap<>();
    private final Clock clock;

    public BaselineMemoryBank() {
        this(Clock.systemUTC());
    }

    public BaselineMemoryBank(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    public Baseline store(String metricName, double mean, double std) {
        Instant now = clock.instant();
        Baseline baseline = new Baseline(metricName, mean, std, now);
        baselines.put(key(metricName, YearMonth.now(clock)), baseline);
        log.info("memory_bank stored baseline metric={} mean={} std={}", metricName, mean, std);
        return baseline;
    }

    public Optional<Baseline> retrieve(String metricName) {
        return retrieve(metricName, YearMonth.now(clock));
    }

    public Optional<Baseline> retrieve(String metricName, YearMonth month) {
        Baseline baseline = baselines.get(key(metricName, month));
        if (baseline == null) {
            log.debug("memory_bank no baseline metric={} month={}", metricName, month);
        }
        return Optional.ofNullable(baseline);
    }

    static String key(String metricName, YearMonth month) {
        return "baseline_" + metricName + "_" + MONTH_KEY.format(month);
    }

    public record Baseline(String metric, double mean, double std, Instant storedAt) {
    }
}
