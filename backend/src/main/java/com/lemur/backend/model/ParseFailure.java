package com.lemur.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Diagnostic dump written whenever backend output could not be parsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "parse_failures")
public class ParseFailure {

    @Id
    private String id;

    private String reason;

    private String backend;

    /**
     * Plain-text dump: reason, timestamp, backend, raw output and the pre-processed text.
     */
    private String dump;

    @CreatedDate
    private Instant createdAt;
}
