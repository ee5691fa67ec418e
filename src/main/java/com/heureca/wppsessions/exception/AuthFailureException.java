package com.heureca.wppsessions.exception;

/**
 * The provider rejected the session's credentials. Terminal until the session is created again.
 */
public class AuthFailureException extends SessionException {

    public AuthFailureException(String sessionId) {
        super(sessionId, "Authentication failed for session " + sessionId);
    }
}
