package com.example.statements.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Error payload returned instead of a statement record.
 */
@JsonPropertyOrder({"code", "message"})
public record ErrorRecord(
        ErrorCode code,
        String message
) {
}
