package com.example.timesheet.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Domain DTO describing one employee's week as read from a timesheet page.
 *
 * @param weekEnding "Week ending" date printed on the page, {@code null} when absent
 * @param dates      header dates per weekday column, empty strings when no date row exists
 * @param days       resolved day entries keyed by weekday name in column order
 */
public record WeekRecord(
        String weekEnding,
        List<String> dates,
        Map<String, DayInfo> days
) {

    public WeekRecord {
        dates = List.copyOf(dates);
        days = Collections.unmodifiableMap(new LinkedHashMap<>(days));
    }

    public DayInfo day(String weekday) {
        return days.get(weekday);
    }
}
