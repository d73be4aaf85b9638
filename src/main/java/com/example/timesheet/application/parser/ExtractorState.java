package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.ShiftCapture;
import com.example.timesheet.domain.model.TimeRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one top-to-bottom pass over the grid.
 * <p>
 * Starts without an active shift. The first shift-time row activates one; later shift-time rows
 * replace the active ranges. The area label changes independently whenever a row carries area
 * text and stays in effect until the next label. Header dates are taken from the first date row only.
 */
public final class ExtractorState {

    private List<TimeRange> lastTimeRanges;
    private String currentArea;
    private List<String> headerDates;
    private final List<ShiftCapture> captures = new ArrayList<>();

    void enterArea(String areaText) {
        if (areaText != null && !areaText.isBlank()) {
            currentArea = areaText.strip();
        }
    }

    void activateShift(List<TimeRange> timeRanges) {
        lastTimeRanges = timeRanges;
    }

    void recordHeaderDates(List<String> dates) {
        if (headerDates == null) {
            headerDates = dates;
        }
    }

    void capture(String weekday, int column, Set<String> flags) {
        if (!hasActiveShift()) {
            throw new IllegalStateException("No shift-time row seen before capturing " + weekday);
        }
        captures.add(new ShiftCapture(weekday, lastTimeRanges.get(column), currentArea, flags));
    }

    public boolean hasActiveShift() {
        return lastTimeRanges != null;
    }

    public List<TimeRange> lastTimeRanges() {
        return lastTimeRanges;
    }

    public String currentArea() {
        return currentArea;
    }

    public List<String> headerDates() {
        return headerDates;
    }

    public List<ShiftCapture> captures() {
        return Collections.unmodifiableList(captures);
    }
}
