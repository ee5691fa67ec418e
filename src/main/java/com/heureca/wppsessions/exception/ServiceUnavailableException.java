package com.heureca.wppsessions.exception;

public class ServiceUnavailableException extends SessionException {

    public ServiceUnavailableException(String sessionId, String message) {
        super(sessionId, message);
    }

    public ServiceUnavailableException(String sessionId, String message, Throwable cause) {
        super(sessionId, message, cause);
    }
}
