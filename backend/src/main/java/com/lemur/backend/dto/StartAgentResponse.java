package com.lemur.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Created session")
public class StartAgentResponse {

    @JsonProperty("session_id")
    @Schema(description = "Session ID to connect to over WebSocket")
    private String sessionId;

    @Schema(description = "Status message")
    private String message;
}
