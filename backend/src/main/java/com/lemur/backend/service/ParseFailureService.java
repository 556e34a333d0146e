package com.lemur.backend.service;

import com.lemur.backend.model.ParseFailure;
import com.lemur.backend.repository.ParseFailureRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Writes a diagnostic dump for backend output that could not be parsed.
 * Best effort: storage problems are logged and swallowed so they never change the
 * outcome of a turn.
 */
@Service
public class ParseFailureService {

    private static final Logger log = LoggerFactory.getLogger(ParseFailureService.class);

    private final ParseFailureRepository parseFailureRepository;

    public ParseFailureService(ParseFailureRepository parseFailureRepository) {
        this.parseFailureRepository = parseFailureRepository;
    }

    public void record(String reason, String rawText, String processedText, String backend) {
        try {
            String dump = "JSON Parse Error: " + reason + "\n"
                    + "Timestamp: " + Instant.now() + "\n"
                    + "Backend: " + backend + "\n"
                    + "Raw Response:\n" + rawText + "\n"
                    + "Processed JSON Text:\n" + processedText + "\n";

            ParseFailure failure = parseFailureRepository.save(ParseFailure.builder()
                    .reason(reason)
                    .backend(backend)
                    .dump(dump)
                    .build());
            log.info("[PARSER] Debug information saved: {}", failure.getId());
        } catch (Exception e) {
            log.error("[PARSER] Failed to save parse failure dump: {}", e.getMessage());
        }
    }
}
