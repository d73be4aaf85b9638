package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.GridRow;
import com.example.timesheet.domain.model.TimeRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Recognises date-header and shift-time rows using the patterns of {@link GridSettings}.
 */
public class RowClassifier {

    private final GridSettings settings;

    public RowClassifier(GridSettings settings) {
        this.settings = settings;
    }

    /**
     * A row holding enough time ranges is a shift-time row even if it also holds dates.
     *
     * @param row grid row
     * @return row role
     */
    public RowKind classify(GridRow row) {
        if (countMatches(row, true) >= settings.minTimeCells()) {
            return RowKind.SHIFT_TIME;
        }
        if (countMatches(row, false) >= settings.minDateCells()) {
            return RowKind.DATE_HEADER;
        }
        return RowKind.CONTENT;
    }

    /**
     * Reads the header dates of a row already classified as {@link RowKind#DATE_HEADER}.
     * Hyphen separators are normalised to dots and cells without a date yield an empty string.
     *
     * @param row grid row
     * @return one entry per column
     */
    public List<String> headerDates(GridRow row) {
        List<String> dates = new ArrayList<>(row.columnCount());
        for (String cell : row.cells()) {
            Matcher matcher = settings.datePattern().matcher(cell);
            dates.add(matcher.find() ? matcher.group(1).replace('-', '.') : "");
        }
        return Collections.unmodifiableList(dates);
    }

    /**
     * Reduces a row already classified as {@link RowKind#SHIFT_TIME} to its time ranges.
     *
     * @param row grid row
     * @return one entry per column, {@code null} where the cell holds no range
     */
    public List<TimeRange> timeRanges(GridRow row) {
        List<TimeRange> ranges = new ArrayList<>(row.columnCount());
        for (String cell : row.cells()) {
            Matcher matcher = settings.timeRangePattern().matcher(cell);
            ranges.add(matcher.find() ? new TimeRange(matcher.group(1), matcher.group(2)) : null);
        }
        return Collections.unmodifiableList(ranges);
    }

    private int countMatches(GridRow row, boolean timeRanges) {
        int count = 0;
        for (String cell : row.cells()) {
            Matcher matcher = (timeRanges ? settings.timeRangePattern() : settings.datePattern()).matcher(cell);
            if (matcher.find()) {
                count++;
            }
        }
        return count;
    }
}
