package com.heureca.wppsessions.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.heureca.wppsessions.service.SessionStateMachine;
import com.heureca.wppsessions.service.client.WhatsAppClient;

/**
 * Live state of one WhatsApp session.
 *
 * <p>Every mutable field is guarded by this session's own lock; readiness waiters park on
 * a condition signalled after each transition. A retired session (deleted, replaced or
 * abandoned after a failed creation) accepts no further events.
 */
public class Session {

    private final String id;
    private final String webhookUrl;
    private final Clock clock;
    private final CompletableFuture<CreationResult> creation = new CompletableFuture<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private SessionStatus status = SessionStatus.INITIALIZING;
    private WhatsAppClient client;
    private String pendingQrCode;
    private boolean initialized;
    private boolean retired;
    private int reconnectAttempts;
    private Instant lastActive;

    public Session(String id, String webhookUrl, Clock clock) {
        this.id = id;
        this.webhookUrl = webhookUrl;
        this.clock = clock;
        this.lastActive = clock.instant();
    }

    public String getId() {
        return id;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    /**
     * Single result shared by every caller waiting on this session's creation.
     */
    public CompletableFuture<CreationResult> creation() {
        return creation;
    }

    /**
     * @return false if the session was retired before its first client could be attached
     */
    public boolean attach(WhatsAppClient client) {
        lock.lock();
        try {
            if (retired) {
                return false;
            }
            if (this.client != null) {
                throw new IllegalStateException("Session " + id + " already owns a client");
            }
            this.client = client;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a client event, provided it was raised by the client this session currently owns.
     *
     * @return the transition taken, empty when the event was ignored
     */
    public Optional<Transition> fire(SessionEvent event, String payload, WhatsAppClient source) {
        lock.lock();
        try {
            if (retired || source != client) {
                return Optional.empty();
            }
            Optional<Transition> transition = SessionStateMachine.next(status, event);
            transition.ifPresent(t -> apply(t, payload));
            return transition;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a DISCONNECTED session back to INITIALIZING on a fresh client.
     *
     * @return the client that was replaced, empty if the session was not eligible
     */
    public Optional<WhatsAppClient> beginReconnect(WhatsAppClient fresh) {
        lock.lock();
        try {
            if (retired) {
                return Optional.empty();
            }
            Optional<Transition> transition = SessionStateMachine.next(status, SessionEvent.RECONNECT);
            if (transition.isEmpty()) {
                return Optional.empty();
            }
            WhatsAppClient previous = client;
            client = fresh;
            apply(transition.get(), null);
            return Optional.ofNullable(previous);
        } finally {
            lock.unlock();
        }
    }

    private void apply(Transition transition, String payload) {
        status = transition.getTo();
        if (transition.has(Transition.Effect.STORE_QR)) {
            pendingQrCode = payload;
        } else if (status != SessionStatus.WAITING_FOR_SCAN) {
            pendingQrCode = null;
        }
        if (transition.has(Transition.Effect.MARK_INITIALIZED)) {
            initialized = true;
            reconnectAttempts = 0;
        }
        if (transition.has(Transition.Effect.MARK_UNINITIALIZED)) {
            initialized = false;
        }
        touchLocked();
        changed.signalAll();
    }

    /**
     * Marks the session dead and hands back its client for the caller to destroy.
     * Only the first call gets the client.
     */
    public WhatsAppClient retire() {
        lock.lock();
        try {
            retired = true;
            WhatsAppClient released = client;
            client = null;
            changed.signalAll();
            return released;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the session is READY and initialized, has failed authentication, has been
     * retired, or the timeout elapses.
     *
     * @return the status observed when the wait ended
     */
    public SessionStatus awaitReady(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (!(status == SessionStatus.READY && initialized)) {
                if (retired || status == SessionStatus.AUTH_FAILED || nanos <= 0L) {
                    return status;
                }
                nanos = changed.awaitNanos(nanos);
            }
            touchLocked();
            return status;
        } finally {
            lock.unlock();
        }
    }

    public int nextReconnectAttempt() {
        lock.lock();
        try {
            return ++reconnectAttempts;
        } finally {
            lock.unlock();
        }
    }

    public void touch() {
        lock.lock();
        try {
            touchLocked();
        } finally {
            lock.unlock();
        }
    }

    private void touchLocked() {
        Instant now = clock.instant();
        if (now.isAfter(lastActive)) {
            lastActive = now;
        }
    }

    public SessionStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public String getPendingQrCode() {
        lock.lock();
        try {
            return pendingQrCode;
        } finally {
            lock.unlock();
        }
    }

    public boolean isInitialized() {
        lock.lock();
        try {
            return initialized;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRetired() {
        lock.lock();
        try {
            return retired;
        } finally {
            lock.unlock();
        }
    }

    public WhatsAppClient getClient() {
        lock.lock();
        try {
            return client;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastActive() {
        lock.lock();
        try {
            return lastActive;
        } finally {
            lock.unlock();
        }
    }

    public SessionMetadata toMetadata() {
        return new SessionMetadata(id, webhookUrl, getStatus());
    }
}
