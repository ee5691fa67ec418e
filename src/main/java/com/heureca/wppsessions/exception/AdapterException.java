package com.heureca.wppsessions.exception;

/**
 * Failure reported by the underlying WhatsApp client.
 */
public class AdapterException extends SessionException {

    public AdapterException(String sessionId, String message) {
        super(sessionId, message);
    }

    public AdapterException(String sessionId, String message, Throwable cause) {
        super(sessionId, message, cause);
    }
}
