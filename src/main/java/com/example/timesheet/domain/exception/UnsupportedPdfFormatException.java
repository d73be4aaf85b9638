package com.example.timesheet.domain.exception;

/**
 * Raised when the uploaded file is neither declared nor named as a PDF.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("File must be a PDF" + (fileName != null && !fileName.isBlank() ? ": " + fileName : "."));
    }
}
