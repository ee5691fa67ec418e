package com.heureca.wppsessions.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome handed back to every caller attached to one session creation.
 */
@Data
@AllArgsConstructor(staticName = "of")
public class CreationResult {
    private SessionStatus status;
    private String qrCode; // only for WAITING_FOR_SCAN
}
