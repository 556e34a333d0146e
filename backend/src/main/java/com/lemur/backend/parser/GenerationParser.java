package com.lemur.backend.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.lemur.backend.model.Generation;
import com.lemur.backend.service.ParseFailureService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers {@code {edits, reasoning}} from completion backend output.
 * <p>
 * Strict decode first; on failure the {@link RepairStep} chain runs once and decode is
 * retried once. A payload needs at least one of the two fields. Any failure produces an
 * error generation and a diagnostic dump.
 */
@Component
public class GenerationParser {

    private static final Logger log = LoggerFactory.getLogger(GenerationParser.class);

    /**
     * Literal the backend puts in {@code edits} once the request is fully handled.
     */
    public static final String COMPLETION_SENTINEL = "TASK_COMPLETE";

    static final String DECODE_FAILURE_PREFIX = "Invalid JSON response from AI: ";
    static final String MISSING_FIELDS_MESSAGE =
            "Invalid response from AI: missing both 'edits' and 'reasoning' fields";
    static final String DEFAULT_COMPLETION_MESSAGE = "Task completed";

    private final ObjectReader strictReader;
    private final ParseFailureService parseFailureService;

    public GenerationParser(ObjectMapper objectMapper, ParseFailureService parseFailureService) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.parseFailureService = parseFailureService;
    }

    public Generation parse(String rawText, String backend) {
        if (rawText == null || rawText.isBlank()) {
            return failure(DECODE_FAILURE_PREFIX + "empty response", "", "", backend);
        }

        String jsonText = stripCodeFence(rawText);
        JsonNode root;
        try {
            root = strictReader.readTree(jsonText);
        } catch (JsonProcessingException e) {
            log.warn("[PARSER] Strict decode failed, attempting repair: {}", e.getOriginalMessage());
            String repaired = RepairStep.applyAll(jsonText);
            try {
                root = strictReader.readTree(repaired);
                log.info("[PARSER] Repaired malformed JSON");
            } catch (JsonProcessingException retry) {
                log.error("[PARSER] Still unable to decode after repair: {}", retry.getOriginalMessage());
                return failure(DECODE_FAILURE_PREFIX + e.getOriginalMessage(), rawText, jsonText, backend);
            }
        }

        if (root == null || !root.isObject()) {
            return failure(DECODE_FAILURE_PREFIX + "expected a JSON object", rawText, jsonText, backend);
        }

        String edits = textOf(root.get("edits"));
        String reasoning = textOf(root.get("reasoning"));
        if (edits.isEmpty() && reasoning.isEmpty()) {
            return failure(MISSING_FIELDS_MESSAGE, rawText, jsonText, backend);
        }

        if (edits.contains(COMPLETION_SENTINEL)) {
            log.info("[PARSER] Completion sentinel received");
            return Generation.completed(reasoning.isEmpty() ? DEFAULT_COMPLETION_MESSAGE : reasoning);
        }
        return Generation.appliedEdit(reasoning, edits.isBlank() ? null : edits);
    }

    /**
     * Trim and remove a surrounding Markdown code fence, with or without a {@code json} tag.
     */
    static String stripCodeFence(String text) {
        String result = text.strip();
        if (result.startsWith("```json")) {
            result = result.substring(7);
        } else if (result.startsWith("```")) {
            result = result.substring(3);
        }
        if (result.endsWith("```")) {
            result = result.substring(0, result.length() - 3);
        }
        return result.strip();
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            node.forEach(item -> parts.add(item.isTextual() ? item.asText() : item.toString()));
            return String.join("\n", parts);
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private Generation failure(String reason, String rawText, String processedText, String backend) {
        log.error("[PARSER] {} | raw (first 500 chars): {}",
                reason, rawText.substring(0, Math.min(500, rawText.length())));
        parseFailureService.record(reason, rawText, processedText, backend);
        return Generation.error(reason);
    }
}
