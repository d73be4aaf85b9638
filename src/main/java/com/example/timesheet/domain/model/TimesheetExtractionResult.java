package com.example.timesheet.domain.model;

/**
 * Domain DTO returned from {@code TimesheetService} to controllers.
 * Bundles the resolved week with the upload context so views can stay presentation-only.
 */
public record TimesheetExtractionResult(
        String fileName,
        String targetName,
        WeekRecord week,
        SourceDocumentInfo document
) {
}
