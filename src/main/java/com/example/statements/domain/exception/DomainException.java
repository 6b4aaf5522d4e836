package com.example.statements.domain.exception;

/**
 * Base type for all domain-level exceptions of the statement engine.
 * Subclasses describe broken statement invariants or rejected inputs without leaking infrastructure details.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which invariant broke
	 */
    protected DomainException(String message) {
        super(message);
    }
}
