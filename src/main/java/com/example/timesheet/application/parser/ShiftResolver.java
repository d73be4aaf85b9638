package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.DayInfo;
import com.example.timesheet.domain.model.ShiftCapture;
import com.example.timesheet.domain.model.WeekRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns the captures of a grid walk into one definitive entry per weekday.
 */
public class ShiftResolver {

    /**
     * @param captures   header dates and captures from {@link ScheduleExtractor}
     * @param weekEnding week ending date from the page text, may be {@code null}
     * @param weekdays   weekday names in column order
     * @return resolved week
     */
    public WeekRecord resolve(ScheduleCaptures captures, String weekEnding, List<String> weekdays) {
        List<String> dates = captures.headerDates();
        Map<String, DayInfo> days = new LinkedHashMap<>();
        for (int column = 0; column < weekdays.size(); column++) {
            String weekday = weekdays.get(column);
            String date = column < dates.size() ? dates.get(column) : "";
            days.put(weekday, resolveDay(captures.capturesFor(weekday), date));
        }
        return new WeekRecord(weekEnding, dates, days);
    }

    /**
     * The capture with the latest start wins; on equal starts the earliest capture is kept.
     * Flags are collected from every capture of the day, not only the winning one.
     *
     * @param captures captures of one weekday in capture order
     * @param date     header date of the weekday column
     * @return resolved day
     */
    DayInfo resolveDay(List<ShiftCapture> captures, String date) {
        ShiftCapture chosen = null;
        TreeSet<String> flags = new TreeSet<>();
        for (ShiftCapture capture : captures) {
            flags.addAll(capture.flags());
            if (!capture.hasTimeRange()) {
                continue;
            }
            if (chosen == null || capture.timeRange().startMinutes() > chosen.timeRange().startMinutes()) {
                chosen = capture;
            }
        }
        String note = flags.isEmpty() ? null : String.join(", ", flags);
        if (chosen == null) {
            return note == null ? DayInfo.off(date) : new DayInfo(null, null, note, date, null);
        }
        return new DayInfo(chosen.timeRange().start(), chosen.timeRange().end(), note, date, chosen.area());
    }
}
