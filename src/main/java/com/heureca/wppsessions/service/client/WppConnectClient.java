package com.heureca.wppsessions.service.client;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heureca.wppsessions.exception.AdapterException;

/**
 * {@link WhatsAppClient} backed by a WPPConnect server.
 *
 * <p>The session's bearer token is its credential and lives in {@code token.json} inside the
 * session's credential directory. Lifecycle events reach this client through the provider
 * webhook and {@link #handleProviderEvent}.
 */
public class WppConnectClient implements WhatsAppClient {

    private static final Logger logger = LoggerFactory.getLogger(WppConnectClient.class);

    static final String TOKEN_FILE = "token.json";

    private final String sessionId;
    private final Path credentialDir;
    private final ClientEventListener listener;
    private final RestTemplate rest;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final WppConnectClientFactory owner;

    private volatile String token;

    WppConnectClient(
            String sessionId,
            Path credentialDir,
            ClientEventListener listener,
            WppConnectClientFactory owner) {
        this.sessionId = sessionId;
        this.credentialDir = credentialDir;
        this.listener = listener;
        this.owner = owner;
        this.rest = owner.getRest();
        this.mapper = owner.getMapper();
        this.executor = owner.getExecutor();
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            token = loadOrGenerateToken();
            Map<?, ?> resp;
            try {
                resp = startSession();
            } catch (HttpClientErrorException.Unauthorized e) {
                logger.warn("WPPCONNECT TOKEN REJECTED | session={} | regenerating", sessionId);
                token = generateToken();
                resp = startSession();
            }
            logger.info("WPPCONNECT START-SESSION | session={} | status={}", sessionId, resp.get("status"));
            interpretStatus(resp);
        }, executor);
    }

    @Override
    public CompletableFuture<Void> destroy() {
        return CompletableFuture.runAsync(() -> {
            if (token == null) {
                token = readStoredToken();
            }
            try {
                String url = String.format("%s/api/%s/close-session", owner.getBaseUrl(), sessionId);
                rest.exchange(url, HttpMethod.POST, new HttpEntity<>(headers()), Void.class);
                logger.info("WPPCONNECT CLOSE-SESSION | session={}", sessionId);
            } catch (HttpClientErrorException.NotFound e) {
                logger.debug("WPPCONNECT CLOSE-SESSION | session={} | already closed", sessionId);
            } catch (RestClientException e) {
                throw new AdapterException(sessionId, "WPPConnect close-session failed: " + e.getMessage(), e);
            } finally {
                owner.release(this);
            }
        }, executor);
    }

    @Override
    public String getState() {
        String url = String.format("%s/api/%s/status-session", owner.getBaseUrl(), sessionId);
        try {
            ResponseEntity<Map> resp = rest.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), Map.class);
            Map<?, ?> body = resp.getBody();
            return body == null ? "UNKNOWN" : Objects.toString(body.get("status"), "UNKNOWN").toUpperCase();
        } catch (RestClientException e) {
            logger.warn("WPPCONNECT STATUS ERROR | session={} | {}", sessionId, e.getMessage());
            return "UNKNOWN";
        }
    }

    /**
     * Translates one webhook payload from WPPConnect into a lifecycle event.
     *
     * @return false if the payload carried nothing this client reacts to
     */
    boolean handleProviderEvent(Map<String, Object> payload) {
        String event = Objects.toString(payload.get("event"), "");
        switch (event) {
            case "qrcode" -> {
                String code = qrFrom(payload);
                if (code == null) {
                    return false;
                }
                listener.onQr(code);
                return true;
            }
            case "status-find" -> {
                return interpretStatusFind(Objects.toString(payload.get("status"), ""));
            }
            default -> {
                logger.debug("WPPCONNECT EVENT IGNORED | session={} | event={}", sessionId, event);
                return false;
            }
        }
    }

    private boolean interpretStatusFind(String status) {
        switch (status) {
            case "qrReadSuccess" -> listener.onAuthenticated();
            case "isLogged", "inChat" -> listener.onReady();
            case "qrReadFail", "autocloseCalled" -> listener.onAuthFailure();
            case "browserClose", "desconnectedMobile", "disconnectedMobile" -> listener.onDisconnected();
            default -> {
                logger.debug("WPPCONNECT STATUS IGNORED | session={} | status={}", sessionId, status);
                return false;
            }
        }
        return true;
    }

    private void interpretStatus(Map<?, ?> resp) {
        String status = Objects.toString(resp.get("status"), "").toUpperCase();
        if ("QRCODE".equals(status)) {
            String code = qrFrom(resp);
            if (code != null) {
                listener.onQr(code);
            }
        } else if ("CONNECTED".equals(status)) {
            listener.onReady();
        }
    }

    private static String qrFrom(Map<?, ?> payload) {
        Object urlcode = payload.get("urlcode");
        if (urlcode != null && !urlcode.toString().isBlank()) {
            return urlcode.toString();
        }
        Object qrcode = payload.get("qrcode");
        return qrcode == null || qrcode.toString().isBlank() ? null : qrcode.toString();
    }

    private Map<?, ?> startSession() {
        String url = String.format("%s/api/%s/start-session", owner.getBaseUrl(), sessionId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("webhook", owner.webhookFor(sessionId));
        body.put("waitQrCode", true);
        try {
            ResponseEntity<Map> resp = rest.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers()), Map.class);
            return resp.getBody() == null ? Map.of() : resp.getBody();
        } catch (HttpClientErrorException.Unauthorized e) {
            throw e;
        } catch (RestClientException e) {
            throw new AdapterException(sessionId, "WPPConnect start-session failed: " + e.getMessage(), e);
        }
    }

    /*
     * ==========================
     * Credentials
     * ==========================
     */

    private String loadOrGenerateToken() {
        String stored = readStoredToken();
        return stored != null ? stored : generateToken();
    }

    private String readStoredToken() {
        Path file = credentialDir.resolve(TOKEN_FILE);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            Map<?, ?> stored = mapper.readValue(file.toFile(), Map.class);
            String existing = Objects.toString(stored.get("token"), null);
            return existing == null || existing.isBlank() ? null : existing;
        } catch (IOException e) {
            logger.warn("WPPCONNECT TOKEN UNREADABLE | session={} | {}", sessionId, e.getMessage());
            return null;
        }
    }

    private String generateToken() {
        String url = String.format("%s/api/%s/%s/generate-token", owner.getBaseUrl(), sessionId, owner.getSecretKey());
        logger.debug("REQUEST WPPCONNECT: generate-token | session={}", sessionId);
        Map<?, ?> resp;
        try {
            resp = rest.postForObject(url, null, Map.class);
        } catch (RestClientException e) {
            throw new AdapterException(sessionId,
                    "Failed to authenticate with WhatsApp provider. "
                            + "Please verify that the WPPConnect secret key is correctly configured.", e);
        }
        String generated = resp == null ? null : Objects.toString(resp.get("token"), null);
        if (generated == null) {
            throw new AdapterException(sessionId, "WPPConnect returned no token for session " + sessionId);
        }

        try {
            Files.createDirectories(credentialDir);
            mapper.writeValue(credentialDir.resolve(TOKEN_FILE).toFile(), Map.of("token", generated));
        } catch (IOException e) {
            throw new AdapterException(sessionId, "Failed to store credentials for session " + sessionId, e);
        }
        return generated;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return headers;
    }
}
