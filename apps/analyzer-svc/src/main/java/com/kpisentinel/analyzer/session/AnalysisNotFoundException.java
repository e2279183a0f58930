package com.kpisentinel.analyzer.session;

public class AnalysisNotFoundException extends RuntimeException {

    private final String sessionId;

    public AnalysisNotFoundException(String sessionId) {
        super("No analysis found for session '" + sessionId + "'; run an analysis first");
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
