package com.kpisentinel.analyzer.session;

import java.util.Optional;
import java.util.function.UnaryOperator;

public interface KpiSessionRepository {

    KpiSession save(KpiSession session);

    Optional<KpiSession> findById(String sessionId);

    /**
     * Atomically replaces the stored session with {@code change.apply(current)}. Exceptions thrown by
     * {@code change} leave the stored session untouched.
     *
     * @throws SessionNotFoundException when no session is stored under {@code sessionId}
     */
    KpiSession update(String sessionId, UnaryOperator<KpiSession> change);

    default KpiSession require(String sessionId) {
        return findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
