package com.example.timesheet.domain.exception;

/**
 * Base type for all domain-level exceptions of the timesheet model.
 * Subclasses describe why an upload cannot yield a schedule without leaking PDFBox or HTTP types.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of what the upload is missing
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of what the upload is missing
	 * @param cause   original exception that triggered the domain failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
