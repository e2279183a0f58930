package com.kpisentinel.analyzer.session;

public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No data found for session '" + sessionId + "'; ingest KPI data first");
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
