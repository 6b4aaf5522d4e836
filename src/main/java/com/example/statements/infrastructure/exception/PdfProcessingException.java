package com.example.statements.infrastructure.exception;

/**
 * Signals that PDFBox could not load an uploaded statement or read its text layer.
 */
public class PdfProcessingException extends InfrastructureException {
	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
