package com.heureca.wppsessions.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotBlank(message = "Session ID is required")
    @Size(max = 64, message = "Session ID must be at most 64 characters")
    @Pattern(regexp = "[A-Za-z0-9_-]+", message = "Session ID may only contain letters, digits, '_' and '-'")
    private String sessionId;

    private String webhookUrl; // optional, stored with the session
}
