package com.heureca.wppsessions.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heureca.wppsessions.dto.CreateSessionRequest;
import com.heureca.wppsessions.exception.AdapterException;
import com.heureca.wppsessions.exception.AuthFailureException;
import com.heureca.wppsessions.exception.CreationTimeoutException;
import com.heureca.wppsessions.exception.InvalidSessionRequestException;
import com.heureca.wppsessions.exception.ServiceUnavailableException;
import com.heureca.wppsessions.exception.SessionException;
import com.heureca.wppsessions.exception.SessionNotFoundException;
import com.heureca.wppsessions.model.CreationResult;
import com.heureca.wppsessions.model.Session;
import com.heureca.wppsessions.model.SessionMetadata;
import com.heureca.wppsessions.model.SessionStatus;
import com.heureca.wppsessions.service.ReadinessGate;
import com.heureca.wppsessions.service.SessionRegistry;
import com.heureca.wppsessions.service.client.WhatsAppClient;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/sessions")
@Tag(name = "Sessions", description = "Create, inspect, list and delete WhatsApp sessions")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final SessionRegistry registry;
    private final ReadinessGate readinessGate;

    public SessionController(SessionRegistry registry, ReadinessGate readinessGate) {
        this.registry = registry;
        this.readinessGate = readinessGate;
    }

    @Operation(summary = "Create a WhatsApp session", description = """
            Starts a session and holds the request until the provider answers.

            - `WAITING_FOR_SCAN` with `qrCode` when the phone has to scan a QR code
            - `READY` when stored credentials were accepted without a scan
            - Calling again for a READY session returns immediately
            """)
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session created or already ready"),
            @ApiResponse(responseCode = "400", description = "Missing or malformed session ID"),
            @ApiResponse(responseCode = "401", description = "Provider rejected the session credentials"),
            @ApiResponse(responseCode = "502", description = "WhatsApp provider failure"),
            @ApiResponse(responseCode = "504", description = "No QR code or readiness within the timeout")
    })
    @PostMapping
    public ResponseEntity<?> createSession(@Valid @RequestBody CreateSessionRequest dto) {
        try {
            CreationResult result = registry.create(dto.getSessionId(), dto.getWebhookUrl());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "success");
            body.put("message", "Session created successfully");
            body.put("sessionId", dto.getSessionId());
            body.put("sessionStatus", result.getStatus());
            if (result.getQrCode() != null) {
                body.put("qrCode", result.getQrCode());
            }
            return ResponseEntity.ok(body);

        } catch (SessionException e) {
            return error(e);
        }
    }

    @Operation(summary = "Get session status", description = """
            Waits until the session is READY (restoring it from saved credentials if needed)
            and returns its status. Fails with 503 if it does not become ready in time.
            """)
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session is ready"),
            @ApiResponse(responseCode = "404", description = "Session not found and could not be restored"),
            @ApiResponse(responseCode = "503", description = "Session is not ready")
    })
    @GetMapping("/{sessionId}/status")
    public ResponseEntity<?> getSessionStatus(@PathVariable String sessionId) {
        try {
            Session session = readinessGate.acquire(sessionId);
            SessionStatus status = session.getStatus();

            Map<String, Object> sessionStatus = new LinkedHashMap<>();
            sessionStatus.put("id", sessionId);
            sessionStatus.put("status", status);
            sessionStatus.put("lastActive", session.getLastActive().toEpochMilli());
            sessionStatus.put("isReady", status == SessionStatus.READY);

            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "sessionStatus", sessionStatus));

        } catch (SessionException e) {
            return error(e);
        }
    }

    @Operation(summary = "Get provider state", description = """
            Waits until the session is READY, then asks the WhatsApp provider for the raw
            connection state of the session (e.g. `CONNECTED`).
            """)
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Provider state returned"),
            @ApiResponse(responseCode = "404", description = "Session not found and could not be restored"),
            @ApiResponse(responseCode = "503", description = "Session is not ready")
    })
    @GetMapping("/{sessionId}/state")
    public ResponseEntity<?> getProviderState(@PathVariable String sessionId) {
        try {
            Session session = readinessGate.acquire(sessionId);
            WhatsAppClient client = session.getClient();
            if (client == null) {
                throw new SessionNotFoundException(sessionId);
            }

            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "whatsappStatus", client.getState()));

        } catch (SessionException e) {
            return error(e);
        }
    }

    @Operation(summary = "List sessions", description = "Live sessions and sessions known from the metadata file.")
    @GetMapping
    public ResponseEntity<?> listSessions() {
        List<SessionMetadata> sessions = registry.list();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "sessions", sessions));
    }

    @Operation(summary = "Delete a session", description = "Closes the client, removes stored credentials and forgets the session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session deleted"),
            @ApiResponse(responseCode = "404", description = "Session not found")
    })
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> deleteSession(@PathVariable String sessionId) {
        try {
            registry.delete(sessionId);
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "message", "Session deleted successfully"));

        } catch (SessionException e) {
            return error(e);
        }
    }

    /*
     * ==========================
     * Helpers
     * ==========================
     */

    private ResponseEntity<?> error(SessionException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            logger.warn("SESSION REQUEST FAILED | session={} | status={} | {}", e.getSessionId(), status.value(), e.getMessage());
        } else {
            logger.debug("SESSION REQUEST REJECTED | session={} | status={} | {}", e.getSessionId(), status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "message", e.getMessage()));
    }

    static HttpStatus statusFor(SessionException e) {
        if (e instanceof InvalidSessionRequestException) {
            return HttpStatus.BAD_REQUEST;
        } else if (e instanceof SessionNotFoundException) {
            return HttpStatus.NOT_FOUND;
        } else if (e instanceof AuthFailureException) {
            return HttpStatus.UNAUTHORIZED;
        } else if (e instanceof CreationTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        } else if (e instanceof ServiceUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else if (e instanceof AdapterException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
