package com.heureca.wppsessions.model;

/**
 * Inputs to the session state machine. The first five come from the WhatsApp
 * client; the last two are raised by the gateway itself.
 */
public enum SessionEvent {
    QR,
    AUTHENTICATED,
    READY,
    AUTH_FAILURE,
    DISCONNECTED,
    RECONNECT,
    INITIALIZE_FAILED
}
