package com.example.timesheet.application.parser;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Declarative pattern contract of a timesheet layout.
 * <p>
 * {@code datePattern} must expose the date as group 1, {@code timeRangePattern} the start and end
 * times as groups 1 and 2, and {@code weekEndingPattern} the week ending date as group 1.
 * Start times are compared by their digit runs (hour, then minutes), so {@code 9:30}, {@code 9.30}
 * and {@code 9h30} formats all order correctly.
 * Patterns are applied with {@link java.util.regex.Matcher#find()}, so a cell only needs to contain a match.
 *
 * @param weekdays          header texts of the weekday columns, leftmost first
 * @param datePattern       date found in header cells
 * @param timeRangePattern  shift range found in shift-time cells
 * @param weekEndingPattern week ending phrase searched in the full page text
 * @param flagMarkers       annotation markers recorded when they share a cell with the target name
 * @param minDateCells      cells that must hold a date for a row to count as the date header
 * @param minTimeCells      cells that must hold a range for a row to count as a shift-time row
 */
public record GridSettings(
        List<String> weekdays,
        Pattern datePattern,
        Pattern timeRangePattern,
        Pattern weekEndingPattern,
        List<String> flagMarkers,
        int minDateCells,
        int minTimeCells
) {

    public static final List<String> DEFAULT_WEEKDAYS = List.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday");
    public static final String DEFAULT_DATE_PATTERN = "(\\d{2}[./-]\\d{2}[./-]\\d{4})";
    public static final String DEFAULT_TIME_RANGE_PATTERN = "(\\d{1,2}:\\d{2})\\s*-\\s*(\\d{1,2}:\\d{2})";
    public static final String DEFAULT_WEEK_ENDING_PATTERN = "Week ending (\\d{2}/\\d{2}/\\d{4})";

    public GridSettings {
        Objects.requireNonNull(datePattern, "datePattern");
        Objects.requireNonNull(timeRangePattern, "timeRangePattern");
        Objects.requireNonNull(weekEndingPattern, "weekEndingPattern");
        weekdays = List.copyOf(weekdays);
        flagMarkers = flagMarkers == null ? List.of() : List.copyOf(flagMarkers);
        if (weekdays.size() < 2) {
            throw new IllegalArgumentException("At least two weekday columns are required.");
        }
        if (minDateCells < 1 || minDateCells > weekdays.size()) {
            throw new IllegalArgumentException("minDateCells must be between 1 and " + weekdays.size());
        }
        if (minTimeCells < 1 || minTimeCells > weekdays.size()) {
            throw new IllegalArgumentException("minTimeCells must be between 1 and " + weekdays.size());
        }
    }

    /**
     * @return settings for the five-column English timesheet layout
     */
    public static GridSettings defaults() {
        return new GridSettings(
                DEFAULT_WEEKDAYS,
                Pattern.compile(DEFAULT_DATE_PATTERN),
                Pattern.compile(DEFAULT_TIME_RANGE_PATTERN),
                Pattern.compile(DEFAULT_WEEK_ENDING_PATTERN),
                List.of("ATM"),
                4,
                3
        );
    }

    /**
     * Copies these settings for a different weekday header order. Thresholds are clamped to the new column count.
     *
     * @param weekdayOrder replacement header texts
     * @return adjusted settings
     */
    public GridSettings withWeekdays(List<String> weekdayOrder) {
        if (weekdayOrder == null || weekdayOrder.equals(weekdays)) {
            return this;
        }
        return new GridSettings(
                weekdayOrder,
                datePattern,
                timeRangePattern,
                weekEndingPattern,
                flagMarkers,
                Math.min(minDateCells, weekdayOrder.size()),
                Math.min(minTimeCells, weekdayOrder.size())
        );
    }

    public int columnCount() {
        return weekdays.size();
    }
}
