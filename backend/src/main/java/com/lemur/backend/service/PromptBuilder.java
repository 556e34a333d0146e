package com.lemur.backend.service;

import com.lemur.backend.client.CompletionRequest;
import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.ConversationTurn;
import com.lemur.backend.model.TurnRole;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a session into the prompt for the next backend call.
 * <p>
 * Slots in the template are filled with plain string replacement; documents are full of
 * braces, so format strings are out.
 */
@Component
public class PromptBuilder {

    static final String TEMPLATE_PATH = "prompts/edit-prompt.txt";
    static final int EDIT_PREVIEW_LENGTH = 200;

    static final String INITIAL_IMAGE_CONTEXT = """

            <image_attached>
            You have a screenshot attached showing the initial state of the webpage before any edits.
            Use it to understand the existing layout, styling and what the user was looking at when making the request.
            </image_attached>
            """;

    static final String FEEDBACK_IMAGE_CONTEXT = """

            <image_attached>
            You have a screenshot attached showing the current state of the webpage after your previous edits.
            Use it to check whether your changes rendered as intended and what still needs adjustment.
            </image_attached>
            """;

    private final String template;
    private final AttachmentStorageService attachmentStorageService;

    public PromptBuilder(AttachmentStorageService attachmentStorageService) {
        this.attachmentStorageService = attachmentStorageService;
        this.template = loadTemplate();
    }

    public CompletionRequest build(AgentSession session) {
        List<ConversationTurn> turns = session.getTurns();
        List<String> context = new ArrayList<>();
        String imageId = null;
        boolean initialImage = false;

        if (turns.isEmpty() && session.getInitialScreenshotId() != null) {
            imageId = session.getInitialScreenshotId();
            initialImage = true;
            context.add("Initial screenshot of the webpage provided for context.");
        }

        for (ConversationTurn turn : turns) {
            if (turn.getRole() == TurnRole.USER) {
                if (hasText(turn.getContent())) {
                    context.add("User: " + turn.getContent());
                }
                if (turn.getAttachmentId() != null) {
                    imageId = turn.getAttachmentId();
                    context.add("User provided a screenshot of the current page.");
                }
            } else {
                if (hasText(turn.getContent())) {
                    context.add("Assistant: " + turn.getContent());
                }
                if (hasText(turn.getEdits())) {
                    String edits = turn.getEdits();
                    context.add("Previous changes made: "
                            + edits.substring(0, Math.min(EDIT_PREVIEW_LENGTH, edits.length())) + "...");
                }
            }
        }

        if (!turns.isEmpty()) {
            context.add("\nIMPORTANT: This is a follow-up request. "
                    + "Consider the previous conversation context when making your changes.");
        }

        String contextText = context.isEmpty() ? "No previous iterations." : String.join("\n", context);
        String query = "Original request: " + session.getOriginalRequest()
                + "\n\nContext from previous iterations:\n" + contextText;
        String imageContext = imageId == null ? "" : initialImage ? INITIAL_IMAGE_CONTEXT : FEEDBACK_IMAGE_CONTEXT;

        // FILE goes last so a document that happens to contain a slot name is left alone.
        String prompt = template
                .replace("{QUERY}", query)
                .replace("{IMAGE_CONTEXT}", imageContext)
                .replace("{FILE}", session.getCurrentShieldedDocument());

        String image = imageId == null ? null : attachmentStorageService.loadBase64(imageId);
        return new CompletionRequest(prompt, image);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String loadTemplate() {
        try {
            return StreamUtils.copyToString(
                    new ClassPathResource(TEMPLATE_PATH).getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt template not found: " + TEMPLATE_PATH, e);
        }
    }
}
