package com.example.timesheet.application.service;

import com.example.timesheet.application.exception.CsvExportValidationException;
import com.example.timesheet.domain.model.DayInfo;
import com.example.timesheet.domain.model.TimesheetExtractionResult;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Application-layer service that turns a resolved week into downloadable CSV content.
 */
@Service
public class ScheduleCsvExportService {

	/**
	 * Builds a CSV document with one line per weekday in column order.
	 *
	 * @param extractionResult cached extraction result stored in the session
	 * @return CSV content ready to stream to the browser
	 * @throws CsvExportValidationException when no week has been parsed yet
	 */
    public String exportWeek(TimesheetExtractionResult extractionResult) {
        if (extractionResult == null || extractionResult.week() == null) {
            throw new CsvExportValidationException("No parsed week available for export.");
        }

        StringBuilder builder = new StringBuilder();
        builder.append("Day,Date,Start,End,Area,Note\n");
        for (Map.Entry<String, DayInfo> entry : extractionResult.week().days().entrySet()) {
            DayInfo day = entry.getValue();
            builder.append(escape(entry.getKey())).append(',')
                    .append(escape(day.date())).append(',')
                    .append(escape(day.start())).append(',')
                    .append(escape(day.end())).append(',')
                    .append(escape(day.area())).append(',')
                    .append(escape(day.note()))
                    .append('\n');
        }
        return builder.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
