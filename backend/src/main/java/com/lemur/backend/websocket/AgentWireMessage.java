package com.lemur.backend.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound WebSocket event. Only the fields relevant to the type are serialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "html", "message", "iteration"})
public class AgentWireMessage {

    public static final String APPLY_EDIT = "apply_edit";
    public static final String COMPLETED = "completed";
    public static final String ERROR = "error";

    private String type;
    private String html;
    private String message;
    private Integer iteration;

    public static AgentWireMessage applyEdit(String html, String message, int iteration) {
        return AgentWireMessage.builder()
                .type(APPLY_EDIT)
                .html(html)
                .message(message != null ? message : "")
                .iteration(iteration)
                .build();
    }

    public static AgentWireMessage completed(String message) {
        return AgentWireMessage.builder().type(COMPLETED).message(message).build();
    }

    public static AgentWireMessage error(String message) {
        return AgentWireMessage.builder().type(ERROR).message(message).build();
    }
}
