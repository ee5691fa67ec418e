package com.heureca.wppsessions.service.client;

import java.util.concurrent.CompletableFuture;

/**
 * One connection to the WhatsApp automation engine. Lifecycle events are delivered
 * asynchronously to the {@link ClientEventListener} the client was created with.
 */
public interface WhatsAppClient {

    CompletableFuture<Void> initialize();

    CompletableFuture<Void> destroy();

    String getState();
}
