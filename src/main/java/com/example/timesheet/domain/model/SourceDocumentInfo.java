package com.example.timesheet.domain.model;

/**
 * Summary of the uploaded PDF taken from its info dictionary and XMP packet.
 * Any field other than the page count may be {@code null}.
 */
public record SourceDocumentInfo(
        int pageCount,
        String title,
        String producer,
        String creationDate,
        String creatorTool
) {
}
