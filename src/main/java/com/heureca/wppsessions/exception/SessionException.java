package com.heureca.wppsessions.exception;

/**
 * Base type for failures surfaced to callers of the session gateway.
 */
public abstract class SessionException extends RuntimeException {

    private final String sessionId;

    protected SessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    protected SessionException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
