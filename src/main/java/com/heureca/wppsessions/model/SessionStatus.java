package com.heureca.wppsessions.model;

public enum SessionStatus {
    INITIALIZING,
    WAITING_FOR_SCAN,
    AUTHENTICATED,
    READY,
    AUTH_FAILED,
    DISCONNECTED
}
