package com.example.timesheet.infrastructure.exception;

/**
 * Base unchecked exception for infrastructure concerns such as reading uploaded bytes with PDFBox.
 * Keeps adapter failures isolated from the domain language.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
