package com.example.timesheet.domain.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shift start and end as printed in a shift-time cell, kept in their textual form ({@code 9:30}, {@code 9h30}).
 */
public record TimeRange(String start, String end) {

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /**
     * Converts the start time into minutes since midnight. The first run of digits is the hour and
     * the second, when present, the minutes; the separator between them does not matter.
     *
     * @return minutes since midnight
     * @throws IllegalArgumentException when the start time holds no digits
     */
    public int startMinutes() {
        Matcher matcher = DIGIT_RUN.matcher(start);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Start time has no hour: " + start);
        }
        int hours = Integer.parseInt(matcher.group());
        int minutes = matcher.find() ? Integer.parseInt(matcher.group()) : 0;
        return hours * 60 + minutes;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
