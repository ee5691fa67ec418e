package com.heureca.wppsessions.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import com.heureca.wppsessions.exception.AdapterException;
import com.heureca.wppsessions.exception.AuthFailureException;
import com.heureca.wppsessions.exception.CreationTimeoutException;
import com.heureca.wppsessions.exception.InvalidSessionRequestException;
import com.heureca.wppsessions.exception.ServiceUnavailableException;
import com.heureca.wppsessions.exception.SessionException;
import com.heureca.wppsessions.exception.SessionNotFoundException;
import com.heureca.wppsessions.model.CreationResult;
import com.heureca.wppsessions.model.Session;
import com.heureca.wppsessions.model.SessionEvent;
import com.heureca.wppsessions.model.SessionMetadata;
import com.heureca.wppsessions.model.SessionStatus;
import com.heureca.wppsessions.model.Transition;
import com.heureca.wppsessions.repository.SessionMetadataRepository;
import com.heureca.wppsessions.service.client.ClientEventListener;
import com.heureca.wppsessions.service.client.WhatsAppClient;
import com.heureca.wppsessions.service.client.WhatsAppClientFactory;

import jakarta.annotation.PreDestroy;

/**
 * Owns every live {@link Session}, keyed by session id.
 *
 * <p>Creation is single-flight per id: concurrent {@link #create} calls for the same id attach
 * to the creating session's result future instead of spawning a second client. Sessions listed
 * in the metadata file at startup but not yet live are kept as dormant entries; they are only
 * brought back to life by {@link #restore}, which the readiness gate calls on first access.
 */
@Service
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final Duration DESTROY_TIMEOUT = Duration.ofSeconds(10);

    private final WhatsAppClientFactory clientFactory;
    private final SessionMetadataRepository metadataRepository;
    private final ReconnectScheduler reconnectScheduler;
    private final Clock clock;
    private final Path dataDir;
    private final Duration creationTimeout;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<CreationResult>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, SessionMetadata> dormant = new ConcurrentHashMap<>();

    private volatile boolean closed;

    public SessionRegistry(
            WhatsAppClientFactory clientFactory,
            SessionMetadataRepository metadataRepository,
            ReconnectScheduler reconnectScheduler,
            Clock clock,
            @Value("${sessions.data-dir:./sessions}") Path dataDir,
            @Value("${sessions.creation-timeout:30s}") Duration creationTimeout) {
        this.clientFactory = clientFactory;
        this.metadataRepository = metadataRepository;
        this.reconnectScheduler = reconnectScheduler;
        this.clock = clock;
        this.dataDir = dataDir;
        this.creationTimeout = creationTimeout;

        for (SessionMetadata entry : metadataRepository.load()) {
            dormant.put(entry.getId(), entry);
        }
        logger.info("Found saved sessions: {}", dormant.size());
    }

    public static String requireValidId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidSessionRequestException(sessionId, "Session ID is required");
        }
        if (!VALID_ID.matcher(sessionId).matches()) {
            throw new InvalidSessionRequestException(sessionId,
                    "Session ID must be 1-64 characters of letters, digits, '_' or '-'");
        }
        return sessionId;
    }

    /*
     * ==========================
     * Create
     * ==========================
     */

    public CreationResult create(String sessionId, String webhookUrl) {
        requireValidId(sessionId);
        ensureOpen(sessionId);

        Session existing = sessions.get(sessionId);
        if (existing != null && existing.getStatus() == SessionStatus.READY) {
            existing.touch();
            return CreationResult.of(SessionStatus.READY, null);
        }

        Session candidate = new Session(sessionId, webhookUrl, clock);
        CompletableFuture<CreationResult> mine = candidate.creation();
        CompletableFuture<CreationResult> flight = inFlight.compute(sessionId,
                (key, current) -> current == null || current.isDone() ? mine : current);
        if (flight == mine) {
            launch(candidate);
        } else {
            logger.debug("CREATE ATTACHED TO IN-FLIGHT CREATION | session={}", sessionId);
        }

        return await(sessionId, flight);
    }

    private void launch(Session session) {
        String id = session.getId();
        CompletableFuture<CreationResult> creation = session.creation();
        SessionMetadata restoredFrom = dormant.remove(id);
        creation.orTimeout(creationTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, failure) -> onCreationSettled(session, restoredFrom, failure));

        // registered before the client exists so delete() can always find and cancel it
        Session previous = sessions.put(id, session);
        CompletableFuture<Void> released = CompletableFuture.completedFuture(null);
        if (previous != null) {
            reconnectScheduler.cancel(id);
            released = release(id, previous.retire());
            logger.info("SESSION REPLACED | session={} | previousStatus={}", id, previous.getStatus());
        }
        if (session.isRetired()) {
            sessions.remove(id, session);
            logger.info("SESSION DELETED BEFORE CLIENT START | session={}", id);
            return;
        }

        WhatsAppClient client;
        try {
            client = spawnClient(session);
        } catch (RuntimeException e) {
            creation.completeExceptionally(new AdapterException(id, "Failed to create client for session " + id, e));
            return;
        }
        if (!session.attach(client)) {
            logger.info("SESSION DELETED BEFORE CLIENT START | session={}", id);
            release(id, client);
            return;
        }

        logger.info("SESSION CREATING | session={}", id);
        persist();

        initializeAfter(released, session, client);
    }

    private CreationResult await(String sessionId, CompletableFuture<CreationResult> flight) {
        try {
            return flight.get(creationTimeout.toMillis() + DESTROY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException(sessionId, "Interrupted while creating session " + sessionId, e);
        } catch (TimeoutException e) {
            throw new CreationTimeoutException(sessionId, creationTimeout);
        } catch (ExecutionException e) {
            throw translate(sessionId, e.getCause());
        }
    }

    private void onCreationSettled(Session session, SessionMetadata restoredFrom, Throwable failure) {
        String id = session.getId();
        inFlight.remove(id, session.creation());
        if (failure == null || closed) {
            return;
        }

        Throwable cause = unwrap(failure);
        if (cause instanceof AuthFailureException) {
            // stays registered as AUTH_FAILED until created again
            return;
        }
        // deleted while creating: delete() owns credentials and metadata, only the session is dropped here
        boolean deleted = cause instanceof SessionNotFoundException;
        if (deleted) {
            logger.debug("SESSION CREATION CANCELLED BY DELETE | session={}", id);
        } else if (cause instanceof TimeoutException) {
            logger.warn("SESSION CREATION TIMEOUT | session={} | timeoutMs={}", id, creationTimeout.toMillis());
        } else {
            logger.warn("SESSION CREATION FAILED | session={} | reason={}", id, cause.getMessage());
        }

        boolean removed = sessions.remove(id, session);
        if (!deleted && restoredFrom != null && !sessions.containsKey(id)) {
            dormant.putIfAbsent(id, restoredFrom);
        }
        release(id, session.retire());
        if (removed && !deleted) {
            persist();
        }
    }

    /*
     * ==========================
     * Lookup
     * ==========================
     */

    public Optional<Session> find(String sessionId) {
        requireValidId(sessionId);
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Session get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Live sessions followed by sessions only known from the metadata file.
     */
    public List<SessionMetadata> list() {
        List<SessionMetadata> result = new ArrayList<>();
        for (Session session : sessions.values()) {
            result.add(session.toMetadata());
        }
        for (SessionMetadata entry : dormant.values()) {
            if (!sessions.containsKey(entry.getId())) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Re-runs the creation protocol for a session that is known but not live, reusing its
     * credential directory so no new QR scan is needed while the credentials stay valid.
     */
    public Session restore(String sessionId) {
        requireValidId(sessionId);
        SessionMetadata known = dormant.get(sessionId);
        if (known == null && !Files.isDirectory(credentialDir(sessionId))) {
            throw new SessionNotFoundException(sessionId, "Session not found and could not be restored: " + sessionId);
        }

        logger.info("Restoring session {}...", sessionId);
        create(sessionId, known != null ? known.getWebhookUrl() : null);
        return get(sessionId);
    }

    /*
     * ==========================
     * Delete
     * ==========================
     */

    public void delete(String sessionId) {
        requireValidId(sessionId);

        Session session = sessions.remove(sessionId);
        SessionMetadata known = dormant.remove(sessionId);
        CompletableFuture<CreationResult> pending = inFlight.get(sessionId);
        boolean creating = pending != null && !pending.isDone();
        if (session == null && known == null && !creating) {
            throw new SessionNotFoundException(sessionId);
        }

        reconnectScheduler.cancel(sessionId);

        if (session != null) {
            WhatsAppClient client = session.retire();
            session.creation().completeExceptionally(new SessionNotFoundException(sessionId));
            inFlight.remove(sessionId, session.creation());
            destroyAndWait(sessionId, client);
        }
        if (creating) {
            // not registered yet; launch() sees the retired session and never starts its client
            pending.completeExceptionally(new SessionNotFoundException(sessionId));
        }

        try {
            removeCredentials(credentialDir(sessionId));
        } catch (IOException e) {
            throw new AdapterException(sessionId, "Failed to remove credentials of session " + sessionId, e);
        } finally {
            persist();
        }

        logger.info("SESSION DELETED | session={}", sessionId);
    }

    /*
     * ==========================
     * Client events
     * ==========================
     */

    void onClientEvent(Session session, WhatsAppClient source, SessionEvent event, String payload) {
        String id = session.getId();
        Optional<Transition> applied = session.fire(event, payload, source);
        if (applied.isEmpty()) {
            logger.debug("EVENT IGNORED | session={} | event={} | status={}", id, event, session.getStatus());
            return;
        }

        Transition transition = applied.get();
        logger.info("SESSION TRANSITION | session={} | event={} | {} -> {}",
                id, event, transition.getFrom(), transition.getTo());
        persist();

        switch (transition.getTo()) {
            case WAITING_FOR_SCAN -> session.creation()
                    .complete(CreationResult.of(SessionStatus.WAITING_FOR_SCAN, session.getPendingQrCode()));
            case READY -> session.creation().complete(CreationResult.of(SessionStatus.READY, null));
            case AUTH_FAILED -> session.creation().completeExceptionally(new AuthFailureException(id));
            default -> {
            }
        }

        if (transition.has(Transition.Effect.SCHEDULE_RECONNECT)) {
            scheduleReconnect(session);
        }
    }

    private void onInitializeFailed(Session session, WhatsAppClient client, Throwable cause) {
        String id = session.getId();
        if (!session.creation().isDone()) {
            session.creation().completeExceptionally(
                    new AdapterException(id, "Failed to initialize client for session " + id, cause));
            return;
        }
        logger.warn("CLIENT INITIALIZE FAILED | session={} | reason={}", id, cause.getMessage());
        onClientEvent(session, client, SessionEvent.INITIALIZE_FAILED, null);
    }

    /*
     * ==========================
     * Reconnect
     * ==========================
     */

    private void scheduleReconnect(Session session) {
        if (closed) {
            return;
        }
        int attempt = session.nextReconnectAttempt();
        reconnectScheduler.schedule(session.getId(), attempt, () -> reconnect(session));
    }

    void reconnect(Session session) {
        String id = session.getId();
        if (closed || sessions.get(id) != session || session.getStatus() != SessionStatus.DISCONNECTED) {
            logger.debug("RECONNECT SKIPPED | session={}", id);
            return;
        }

        logger.info("Attempting to reconnect session {}...", id);
        WhatsAppClient fresh;
        try {
            fresh = spawnClient(session);
        } catch (RuntimeException e) {
            logger.warn("RECONNECT CLIENT CREATION FAILED | session={} | reason={}", id, e.getMessage());
            scheduleReconnect(session);
            return;
        }

        Optional<WhatsAppClient> replaced = session.beginReconnect(fresh);
        if (replaced.isEmpty()) {
            release(id, fresh);
            return;
        }

        persist();
        initializeAfter(release(id, replaced.get()), session, fresh);
    }

    /*
     * ==========================
     * Internals
     * ==========================
     */

    private WhatsAppClient spawnClient(Session session) {
        Router router = new Router(session);
        WhatsAppClient client = clientFactory.create(session.getId(), credentialDir(session.getId()), router);
        router.bind(client);
        return client;
    }

    public Path credentialDir(String sessionId) {
        return dataDir.resolve(sessionId);
    }

    void removeCredentials(Path dir) throws IOException {
        FileSystemUtils.deleteRecursively(dir);
    }

    private void persist() {
        metadataRepository.save(this::list);
    }

    private void ensureOpen(String sessionId) {
        if (closed) {
            throw new ServiceUnavailableException(sessionId, "Session gateway is shutting down");
        }
    }

    /**
     * Destroys a client without blocking. The returned future always completes normally,
     * at the latest after the destroy timeout.
     */
    private CompletableFuture<Void> release(String sessionId, WhatsAppClient client) {
        if (client == null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> destroyed;
        try {
            destroyed = client.destroy().copy();
        } catch (RuntimeException e) {
            destroyed = CompletableFuture.failedFuture(e);
        }
        return destroyed.orTimeout(DESTROY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, failure) -> {
                    if (failure != null) {
                        logger.warn("CLIENT DESTROY FAILED | session={} | reason={}", sessionId, unwrap(failure).toString());
                    }
                    return null;
                });
    }

    /**
     * Starts a client once the client it replaces is gone: both talk to the same provider
     * session, so a late close from the old one would kill the new one.
     */
    private void initializeAfter(CompletableFuture<Void> released, Session session, WhatsAppClient client) {
        released.thenCompose(ignored -> session.getClient() == client
                        ? client.initialize()
                        : CompletableFuture.<Void>completedFuture(null))
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        onInitializeFailed(session, client, unwrap(failure));
                    }
                });
    }

    private void destroyAndWait(String sessionId, WhatsAppClient client) {
        if (client == null) {
            return;
        }
        try {
            client.destroy().get(DESTROY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("CLIENT DESTROY INTERRUPTED | session={}", sessionId);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            logger.warn("CLIENT DESTROY FAILED | session={} | reason={}", sessionId, unwrap(e).toString());
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private RuntimeException translate(String sessionId, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TimeoutException) {
            return new CreationTimeoutException(sessionId, creationTimeout);
        }
        if (cause instanceof SessionException sessionException) {
            return sessionException;
        }
        return new AdapterException(sessionId, "Session " + sessionId + " failed: " + cause.getMessage(), cause);
    }

    @PreDestroy
    public void shutdown() {
        closed = true;
        reconnectScheduler.cancelAll();
        for (Session session : sessions.values()) {
            session.creation().completeExceptionally(
                    new ServiceUnavailableException(session.getId(), "Session gateway is shutting down"));
            release(session.getId(), session.retire());
        }
        logger.info("SESSION REGISTRY CLOSED | sessions={}", sessions.size());
    }

    /**
     * Forwards one client's events to its session; events from a client the session
     * no longer owns are dropped by {@link Session#fire}.
     */
    private final class Router implements ClientEventListener {

        private final Session session;
        private volatile WhatsAppClient client;

        Router(Session session) {
            this.session = session;
        }

        void bind(WhatsAppClient client) {
            this.client = client;
        }

        @Override
        public void onQr(String code) {
            onClientEvent(session, client, SessionEvent.QR, code);
        }

        @Override
        public void onAuthenticated() {
            onClientEvent(session, client, SessionEvent.AUTHENTICATED, null);
        }

        @Override
        public void onReady() {
            onClientEvent(session, client, SessionEvent.READY, null);
        }

        @Override
        public void onAuthFailure() {
            onClientEvent(session, client, SessionEvent.AUTH_FAILURE, null);
        }

        @Override
        public void onDisconnected() {
            onClientEvent(session, client, SessionEvent.DISCONNECTED, null);
        }
    }
}
