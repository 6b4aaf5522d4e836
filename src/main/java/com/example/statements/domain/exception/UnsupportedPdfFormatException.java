package com.example.statements.domain.exception;

/**
 * Raised when an uploaded file does not look like a PDF statement.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF statements are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
