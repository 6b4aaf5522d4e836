package com.example.statements.domain.model;

/**
 * Raw input of one extraction: statement text and the filename it came from.
 */
public record StatementSource(
        String text,
        String filename
) {
}
