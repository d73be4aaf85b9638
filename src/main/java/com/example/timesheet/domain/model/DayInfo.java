package com.example.timesheet.domain.model;

/**
 * Resolved schedule for a single weekday.
 * Times stay in their printed {@code H:MM} form; {@code note} is a comma separated list of flags.
 */
public record DayInfo(
        String start,
        String end,
        String note,
        String date,
        String area
) {

    public static DayInfo off(String date) {
        return new DayInfo(null, null, null, date, null);
    }

    public boolean working() {
        return start != null;
    }
}
