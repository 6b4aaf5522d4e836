package com.example.statements.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of one document inside a batch run.
 */
@JsonPropertyOrder({"filename", "response"})
public record BatchItemResult(
        String filename,
        StatementResponse response
) {
}
