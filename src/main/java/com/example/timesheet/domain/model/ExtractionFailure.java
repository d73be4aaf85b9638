package com.example.timesheet.domain.model;

/**
 * Reasons a timesheet page yields no schedule.
 */
public enum ExtractionFailure {
    NO_PAGES("The document has no pages."),
    TARGET_NOT_PRESENT("The employee name does not appear on the timesheet."),
    LAYOUT_NOT_DETECTED("The weekday columns could not be located."),
    MALFORMED_INPUT("The timesheet content could not be interpreted.");

    private final String description;

    ExtractionFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
