package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.ShiftCapture;

import java.util.List;

/**
 * Output of the grid walk: the header dates (empty strings when no date row exists) and every
 * capture in the order it was made.
 */
public record ScheduleCaptures(
        List<String> headerDates,
        List<ShiftCapture> captures
) {

    public ScheduleCaptures {
        headerDates = List.copyOf(headerDates);
        captures = List.copyOf(captures);
    }

    public List<ShiftCapture> capturesFor(String weekday) {
        return captures.stream().filter(capture -> capture.weekday().equals(weekday)).toList();
    }
}
