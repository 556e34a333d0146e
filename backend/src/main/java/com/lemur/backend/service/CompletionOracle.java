package com.lemur.backend.service;

import com.lemur.backend.client.CompletionBackend;
import com.lemur.backend.client.CompletionRequest;
import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.Generation;
import com.lemur.backend.parser.GenerationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One completion turn: prompt from the session, call the session's backend, parse the answer.
 * Transport failures propagate as {@link com.lemur.backend.client.CompletionException};
 * unparseable answers come back as an error generation.
 */
@Service
public class CompletionOracle {

    private static final Logger log = LoggerFactory.getLogger(CompletionOracle.class);

    private final PromptBuilder promptBuilder;
    private final GenerationParser generationParser;

    public CompletionOracle(PromptBuilder promptBuilder, GenerationParser generationParser) {
        this.promptBuilder = promptBuilder;
        this.generationParser = generationParser;
    }

    public Generation generate(AgentSession session, CompletionBackend backend) throws InterruptedException {
        CompletionRequest request = promptBuilder.build(session);
        log.info("[ORACLE] Session {} | iteration {} | backend: {}",
                session.getId(), session.getCurrentIteration(), backend.name());

        String raw = backend.complete(request);
        Generation generation = generationParser.parse(raw, backend.name());
        log.info("[ORACLE] Session {} | generation status: {}", session.getId(), generation.status());
        return generation;
    }
}
