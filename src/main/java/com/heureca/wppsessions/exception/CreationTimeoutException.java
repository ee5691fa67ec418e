package com.heureca.wppsessions.exception;

import java.time.Duration;

/**
 * Neither a QR challenge nor readiness was observed while creating a session.
 */
public class CreationTimeoutException extends SessionException {

    public CreationTimeoutException(String sessionId, Duration timeout) {
        super(sessionId, "QR Code generation timeout for session " + sessionId
                + " after " + timeout.toSeconds() + "s");
    }
}
