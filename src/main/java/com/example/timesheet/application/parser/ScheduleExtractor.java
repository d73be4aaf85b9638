package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.GridRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks classified grid rows once, top to bottom, and records where the target name appears
 * below an active shift-time row.
 */
public class ScheduleExtractor {

    private static final Logger log = LoggerFactory.getLogger(ScheduleExtractor.class);

    private final GridSettings settings;
    private final RowClassifier classifier;

    public ScheduleExtractor(GridSettings settings, RowClassifier classifier) {
        this.settings = settings;
        this.classifier = classifier;
    }

    /**
     * @param rows       grid rows ordered top to bottom
     * @param targetName employee name, matched case-insensitively as a substring of a cell
     * @return header dates and captures
     */
    public ScheduleCaptures extract(List<GridRow> rows, String targetName) {
        ExtractorState state = walk(rows, targetName);
        List<String> dates = state.headerDates() != null
                ? state.headerDates()
                : Collections.nCopies(settings.columnCount(), "");
        return new ScheduleCaptures(dates, state.captures());
    }

    /**
     * Runs the pass and exposes the final state.
     *
     * @param rows       grid rows ordered top to bottom
     * @param targetName employee name
     * @return state after the last row
     */
    ExtractorState walk(List<GridRow> rows, String targetName) {
        String needle = targetName.toLowerCase(Locale.ROOT);
        ExtractorState state = new ExtractorState();
        for (GridRow row : rows) {
            if (row.hasAreaText()) {
                state.enterArea(row.areaText());
            }

            RowKind kind = classifier.classify(row);
            if (kind == RowKind.SHIFT_TIME) {
                state.activateShift(classifier.timeRanges(row));
                log.debug("Shift-time row at {}: {}", row.rowKey(), state.lastTimeRanges());
                continue;
            }
            // only the first date row is the header; later ones are scanned like any content row
            if (kind == RowKind.DATE_HEADER && state.headerDates() == null) {
                state.recordHeaderDates(classifier.headerDates(row));
                continue;
            }
            if (!state.hasActiveShift()) {
                continue;
            }

            int columns = Math.min(row.columnCount(), settings.columnCount());
            for (int column = 0; column < columns; column++) {
                String cell = row.cell(column).strip();
                if (cell.isEmpty() || !cell.toLowerCase(Locale.ROOT).contains(needle)) {
                    continue;
                }
                state.capture(settings.weekdays().get(column), column, flagsIn(cell));
            }
        }
        log.debug("Captured {} occurrence(s) of '{}'", state.captures().size(), targetName);
        return state;
    }

    private Set<String> flagsIn(String cell) {
        String upper = cell.toUpperCase(Locale.ROOT);
        Set<String> flags = new LinkedHashSet<>();
        for (String marker : settings.flagMarkers()) {
            if (upper.contains(marker.toUpperCase(Locale.ROOT))) {
                flags.add(marker);
            }
        }
        return flags;
    }
}
