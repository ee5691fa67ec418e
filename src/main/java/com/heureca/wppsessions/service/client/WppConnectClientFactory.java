package com.heureca.wppsessions.service.client;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Creates {@link WppConnectClient}s and routes provider webhooks to the live client of a session.
 */
@Component
public class WppConnectClientFactory implements WhatsAppClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(WppConnectClientFactory.class);

    private final RestTemplate rest;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final String baseUrl;
    private final String secretKey;
    private final String webhookUrl;

    private final Map<String, WppConnectClient> clients = new ConcurrentHashMap<>();

    public WppConnectClientFactory(
            RestTemplate rest,
            ObjectMapper mapper,
            @Qualifier("providerExecutor") Executor executor,
            @Value("${wpp.base-url}") String baseUrl,
            @Value("${wpp.secret-key}") String secretKey,
            @Value("${wpp.webhook-url}") String webhookUrl) {
        this.rest = rest;
        this.mapper = mapper;
        this.executor = executor;
        this.baseUrl = baseUrl;
        this.secretKey = secretKey;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public WhatsAppClient create(String sessionId, Path credentialDir, ClientEventListener listener) {
        WppConnectClient client = new WppConnectClient(sessionId, credentialDir, listener, this);
        WppConnectClient previous = clients.put(sessionId, client);
        if (previous != null) {
            logger.debug("WPPCONNECT CLIENT SUPERSEDED | session={}", sessionId);
        }
        return client;
    }

    /**
     * @return false when no live client exists for the session or the event was not understood
     */
    public boolean dispatch(String sessionId, Map<String, Object> payload) {
        WppConnectClient client = clients.get(sessionId);
        if (client == null) {
            logger.debug("WPPCONNECT WEBHOOK FOR UNKNOWN SESSION | session={} | event={}",
                    sessionId, payload.get("event"));
            return false;
        }
        return client.handleProviderEvent(payload);
    }

    void release(WppConnectClient client) {
        clients.remove(client.getSessionId(), client);
    }

    String webhookFor(String sessionId) {
        String base = webhookUrl.endsWith("/") ? webhookUrl.substring(0, webhookUrl.length() - 1) : webhookUrl;
        return base + "/" + sessionId;
    }

    RestTemplate getRest() {
        return rest;
    }

    ObjectMapper getMapper() {
        return mapper;
    }

    Executor getExecutor() {
        return executor;
    }

    String getBaseUrl() {
        return baseUrl;
    }

    String getSecretKey() {
        return secretKey;
    }
}
