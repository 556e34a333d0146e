package com.lemur.backend.websocket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound WebSocket frame. Only {@code observation} frames carry meaning.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {

    public static final String OBSERVATION = "observation";

    private String type;
    private ObservationData data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ObservationData {
        private String summary;
        private String screenshot;
    }
}
