package com.example.timesheet.infrastructure.exception;

/**
 * Signals that PDFBox could not load the uploaded timesheet or strip its first page.
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
