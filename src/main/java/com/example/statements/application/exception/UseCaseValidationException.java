package com.example.statements.application.exception;

/**
 * Signals that a request to a statement use case is invalid before any document is processed.
 * The API layer translates it into an HTTP 400 response.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
