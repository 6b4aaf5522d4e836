package com.example.statements.interfaces.api.dto;

import com.example.statements.domain.model.StatementSource;

/**
 * JSON body of the parse and batch endpoints.
 *
 * @param text     statement text layer
 * @param filename source filename, must end in {@code .pdf}
 */
public record ParseStatementRequest(
        String text,
        String filename
) {
    public StatementSource toSource() {
        return new StatementSource(text, filename);
    }
}
