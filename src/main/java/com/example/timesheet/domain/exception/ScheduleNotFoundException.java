package com.example.timesheet.domain.exception;

import com.example.timesheet.domain.model.ExtractionFailure;

/**
 * Raised when a timesheet page cannot be turned into a week schedule for the requested employee.
 * Every structural failure surfaces through this type; {@link #reason()} tells them apart.
 */
public class ScheduleNotFoundException extends DomainException {

    private final ExtractionFailure reason;

	/**
	 * Creates the exception for a structural failure detected by the parser.
	 *
	 * @param reason failure category
	 */
    public ScheduleNotFoundException(ExtractionFailure reason) {
        super(reason.description());
        this.reason = reason;
    }

	/**
	 * Creates the exception for an unexpected error raised while walking the grid.
	 *
	 * @param reason failure category
	 * @param cause  error raised by the parser internals
	 */
    public ScheduleNotFoundException(ExtractionFailure reason, Throwable cause) {
        super(reason.description(), cause);
        this.reason = reason;
    }

    public ExtractionFailure reason() {
        return reason;
    }
}
