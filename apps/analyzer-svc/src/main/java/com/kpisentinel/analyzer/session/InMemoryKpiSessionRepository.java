package com.kpisentinel.analyzer.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryKpiSessionRepository implements KpiSessionRepository {

    private final Map<String, KpiSession> storage = new ConcurrentHashMap<>();

    @Override
    public KpiSession save(KpiSession session) {
        storage.put(session.sessionId(), session);
        return session;
    }

    @Override
    public Optional<KpiSession> findById(String sessionId) {
        return Optional.ofNullable(storage.get(sessionId));
    }

    @Override
    public KpiSession update(String sessionId, UnaryOperator<KpiSession> change) {
        return storage.compute(sessionId, (id, current) -> {
            if (current == null) {
                throw new SessionNotFoundException(id);
            }
            return change.apply(current);
        });
    }
}
