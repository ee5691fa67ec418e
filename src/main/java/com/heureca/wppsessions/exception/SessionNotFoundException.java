package com.heureca.wppsessions.exception;

public class SessionNotFoundException extends SessionException {

    public SessionNotFoundException(String sessionId) {
        super(sessionId, "Session not found: " + sessionId);
    }

    public SessionNotFoundException(String sessionId, String message) {
        super(sessionId, message);
    }
}
