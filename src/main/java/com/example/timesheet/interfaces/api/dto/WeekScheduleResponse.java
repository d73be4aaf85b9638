package com.example.timesheet.interfaces.api.dto;

import com.example.timesheet.domain.model.DayInfo;
import com.example.timesheet.domain.model.SourceDocumentInfo;
import com.example.timesheet.domain.model.TimesheetExtractionResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON body returned by the upload endpoints. Field names follow the wire format the browser client reads.
 */
public record WeekScheduleResponse(
        @JsonProperty("week_ending") String weekEnding,
        List<String> dates,
        Map<String, DayInfo> days,
        @JsonProperty("file_name") String fileName,
        SourceDocumentInfo document,
        boolean success
) {

    public static WeekScheduleResponse from(TimesheetExtractionResult result) {
        return new WeekScheduleResponse(
                result.week().weekEnding(),
                result.week().dates(),
                result.week().days(),
                result.fileName(),
                result.document(),
                true
        );
    }
}
