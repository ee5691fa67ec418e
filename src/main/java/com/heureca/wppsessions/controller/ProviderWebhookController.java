package com.heureca.wppsessions.controller;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heureca.wppsessions.service.client.WppConnectClientFactory;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/api/provider")
@Tag(name = "Provider Webhook", description = "Lifecycle events pushed by the WPPConnect server")
public class ProviderWebhookController {

    private static final Logger logger = LoggerFactory.getLogger(ProviderWebhookController.class);

    private final WppConnectClientFactory clientFactory;

    public ProviderWebhookController(WppConnectClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Operation(summary = "Receive a WPPConnect webhook", description = """
            Always answers 200 so the provider does not retry; `dispatched` tells whether
            the event reached a live session.
            """)
    @PostMapping("/webhook/{session}")
    public ResponseEntity<?> receive(
            @PathVariable String session,
            @RequestBody Map<String, Object> payload) {

        logger.debug("WEBHOOK WPPCONNECT | session={} | event={}", session, payload.get("event"));

        boolean dispatched = clientFactory.dispatch(session, payload);
        return ResponseEntity.ok(Map.of(
                "received", true,
                "dispatched", dispatched));
    }
}
