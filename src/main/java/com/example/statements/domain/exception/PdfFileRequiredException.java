package com.example.statements.domain.exception;

/**
 * Raised when a statement upload arrives without a file.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a PDF statement to upload.");
    }
}
