package com.lemur.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to start an editing session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to start an agent editing session")
public class StartAgentRequest {

    @NotBlank
    @Schema(description = "Document to edit", example = "<html><body><h1>Hi</h1></body></html>")
    private String html;

    @NotBlank
    @Schema(description = "What the agent should do", example = "Make the heading blue")
    private String query;

    @JsonProperty("model_type")
    @Schema(description = "Completion backend (optional)", example = "openrouter")
    private String modelType;

    @JsonProperty("initial_screenshot")
    @Schema(description = "Base64 screenshot of the current rendering (optional)")
    private String initialScreenshot;
}
