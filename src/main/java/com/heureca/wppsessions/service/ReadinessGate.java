package com.heureca.wppsessions.service;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.heureca.wppsessions.exception.AuthFailureException;
import com.heureca.wppsessions.exception.ServiceUnavailableException;
import com.heureca.wppsessions.exception.SessionNotFoundException;
import com.heureca.wppsessions.model.Session;
import com.heureca.wppsessions.model.SessionStatus;

/**
 * Hands out sessions only once they are READY.
 *
 * <p>A session that is known but not live is restored first. Waiting is bounded by the
 * configured ready timeout and wakes up on the session's own transition signal.
 */
@Service
public class ReadinessGate {

    private static final Logger logger = LoggerFactory.getLogger(ReadinessGate.class);

    private final SessionRegistry registry;
    private final Duration readyTimeout;

    public ReadinessGate(
            SessionRegistry registry,
            @Value("${sessions.ready-timeout:30s}") Duration readyTimeout) {
        this.registry = registry;
        this.readyTimeout = readyTimeout;
    }

    public Session acquire(String sessionId) {
        Session session = registry.find(sessionId).orElseGet(() -> registry.restore(sessionId));

        SessionStatus observed;
        try {
            observed = session.awaitReady(readyTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException(sessionId, "Interrupted while waiting for session " + sessionId, e);
        }

        if (session.isRetired()) {
            throw new SessionNotFoundException(sessionId);
        }
        if (observed == SessionStatus.AUTH_FAILED) {
            throw new AuthFailureException(sessionId);
        }
        if (observed != SessionStatus.READY) {
            logger.warn("SESSION NOT READY | session={} | status={} | waitedMs={}",
                    sessionId, observed, readyTimeout.toMillis());
            throw new ServiceUnavailableException(sessionId, "Session is not ready. Please try again later.");
        }
        return session;
    }
}
