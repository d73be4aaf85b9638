package com.example.timesheet.domain.model;

import java.util.Set;

/**
 * One occurrence of the target name below an active shift-time row.
 *
 * @param weekday   weekday owning the column the name was found in
 * @param timeRange active time range of that column, {@code null} when the column had none
 * @param area      sticky area label in effect for the row, {@code null} when none was seen yet
 * @param flags     annotation markers found in the same cell
 */
public record ShiftCapture(
        String weekday,
        TimeRange timeRange,
        String area,
        Set<String> flags
) {

    public ShiftCapture {
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }

    public boolean hasTimeRange() {
        return timeRange != null;
    }
}
