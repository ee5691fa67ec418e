package com.heureca.wppsessions.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the persisted sessions file. Credentials never appear here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetadata {
    private String id;
    private String webhookUrl;
    private SessionStatus status;
}
