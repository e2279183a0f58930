package com.kpisentinel.analyzer.session;

public class SessionChangedException extends RuntimeException {

    private final String sessionId;

    public SessionChangedException(String sessionId, String reason) {
        super("Session '" + sessionId + "' changed while the request was running: " + reason);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
