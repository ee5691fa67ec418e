package com.heureca.wppsessions.exception;

public class InvalidSessionRequestException extends SessionException {

    public InvalidSessionRequestException(String sessionId, String message) {
        super(sessionId, message);
    }
}
