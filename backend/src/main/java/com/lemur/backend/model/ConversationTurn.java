package com.lemur.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of a session's turn log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    private TurnRole role;

    private String content;

    private Instant timestamp;

    /**
     * Patch instructions the agent produced on this turn, if any.
     */
    private String edits;

    /**
     * GridFS id of a screenshot attached to this turn.
     */
    private String attachmentId;

    public static ConversationTurn user(String content, String attachmentId) {
        return ConversationTurn.builder()
                .role(TurnRole.USER)
                .content(content)
                .attachmentId(attachmentId)
                .timestamp(Instant.now())
                .build();
    }

    public static ConversationTurn agent(String content, String edits) {
        return ConversationTurn.builder()
                .role(TurnRole.AGENT)
                .content(content)
                .edits(edits)
                .timestamp(Instant.now())
                .build();
    }
}
