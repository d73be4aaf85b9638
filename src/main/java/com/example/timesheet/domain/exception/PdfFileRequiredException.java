package com.example.timesheet.domain.exception;

/**
 * Raised when an upload request carries no timesheet file or an empty one.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with the message shown when the upload form is submitted without a file.
	 */
    public PdfFileRequiredException() {
        super("No PDF file provided.");
    }
}
