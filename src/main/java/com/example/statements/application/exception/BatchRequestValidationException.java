package com.example.statements.application.exception;

/**
 * Thrown when a batch request cannot be run, for example because it holds no documents.
 */
public class BatchRequestValidationException extends UseCaseValidationException {

    public BatchRequestValidationException(String message) {
        super(message);
    }
}
