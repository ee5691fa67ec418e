package com.heureca.wppsessions.service.client;

import java.nio.file.Path;

public interface WhatsAppClientFactory {

    /**
     * Builds an uninitialized client for one session.
     *
     * @param sessionId     caller supplied session key
     * @param credentialDir directory owned exclusively by this session's credentials
     * @param listener      receives the client's lifecycle events
     */
    WhatsAppClient create(String sessionId, Path credentialDir, ClientEventListener listener);
}
