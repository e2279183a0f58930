package com.kpisentinel.analyzer.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kpisentinel.analyzer.model.DetectionMethod;
import com.kpisentinel.analyzer.model.KpiDataset;
import com.kpisentinel.analyzer.model.Sensitivity;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryKpiSessionRepositoryTest {

    private final InMemoryKpiSessionRepository repository = new InMemoryKpiSessionRepository();

    @Test
    void updateReplacesStoredSession() {
        repository.save(KpiSession.ingested("s1", dataset(), dataset(), Instant.now()));
        KpiSession.AnalysisRun run = new KpiSession.AnalysisRun(Instant.now(), DetectionMethod.IQR, Sensitivity.LOW);

        KpiSession updated = repository.update("s1", current -> current.withAnalyses(Map.of(), run));

        assertThat(repository.require("s1")).isSameAs(updated);
        assertThat(updated.lastRun()).isSameAs(run);
    }

    @Test
    void updateOfUnknownSessionFails() {
        assertThatThrownBy(() -> repository.update("missing", current -> current))
                .isInstanceOf(SessionNotFoundException.class);
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    void failedChangeKeepsCurrentSession() {
        KpiSession original = repository.save(KpiSession.ingested("s1", dataset(), dataset(), Instant.now()));

        assertThatThrownBy(() -> repository.update("s1", current -> {
            throw new SessionChangedException("s1", "stale");
        })).isInstanceOf(SessionChangedException.class);

        assertThat(repository.require("s1")).isSameAs(original);
    }

    private static KpiDataset dataset() {
        return new KpiDataset(List.of("Sales"), List.of(List.of("1")), List.of(), Map.of("Sales", new double[]{1}));
    }
}
