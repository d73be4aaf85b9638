package com.example.timesheet.application.exception;

/**
 * Thrown when the cached week cannot be exported, typically because nothing was parsed yet in the session.
 */
public class CsvExportValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public CsvExportValidationException(String message) {
        super(message);
    }
}
