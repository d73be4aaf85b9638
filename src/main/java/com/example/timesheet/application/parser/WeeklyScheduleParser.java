package com.example.timesheet.application.parser;

import com.example.timesheet.domain.exception.ScheduleNotFoundException;
import com.example.timesheet.domain.model.ColumnBoundaries;
import com.example.timesheet.domain.model.ExtractionFailure;
import com.example.timesheet.domain.model.GridRow;
import com.example.timesheet.domain.model.PageContent;
import com.example.timesheet.domain.model.WeekRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Reconstructs one employee's week from the positioned words of a timesheet page.
 * <p>
 * The pipeline runs column detection, row grouping, row classification, the grid walk and
 * day resolution in that order. Instances hold no per-call state and may be shared.
 */
public class WeeklyScheduleParser {

    private static final Logger log = LoggerFactory.getLogger(WeeklyScheduleParser.class);

    private final GridSettings settings;
    private final ColumnLayoutDetector layoutDetector = new ColumnLayoutDetector();
    private final RowGrouper rowGrouper = new RowGrouper();
    private final ShiftResolver resolver = new ShiftResolver();

    public WeeklyScheduleParser(GridSettings settings) {
        this.settings = settings;
    }

    /**
     * Extracts the week using the configured weekday order.
     *
     * @param page       text and tokens of the page
     * @param targetName employee name to look for
     * @return resolved week
     * @throws ScheduleNotFoundException when the page yields no schedule for the name
     */
    public WeekRecord extract(PageContent page, String targetName) {
        return extract(page, targetName, settings.weekdays());
    }

    /**
     * Extracts the week for an explicit weekday header order.
     *
     * @param page         text and tokens of the page
     * @param targetName   employee name to look for
     * @param weekdayOrder weekday header texts, leftmost column first
     * @return resolved week
     * @throws ScheduleNotFoundException when the name is absent, the weekday columns cannot be located
     *                                   or the content cannot be interpreted
     */
    public WeekRecord extract(PageContent page, String targetName, List<String> weekdayOrder) {
        if (targetName == null || targetName.isBlank()
                || !page.fullText().toLowerCase(Locale.ROOT).contains(targetName.strip().toLowerCase(Locale.ROOT))) {
            throw new ScheduleNotFoundException(ExtractionFailure.TARGET_NOT_PRESENT);
        }
        try {
            return parseGrid(page, targetName.strip(), settings.withWeekdays(weekdayOrder));
        } catch (ScheduleNotFoundException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while reading the timesheet grid", ex);
            throw new ScheduleNotFoundException(ExtractionFailure.MALFORMED_INPUT, ex);
        }
    }

    private WeekRecord parseGrid(PageContent page, String targetName, GridSettings effective) {
        List<String> weekdays = effective.weekdays();
        ColumnBoundaries boundaries = layoutDetector.detect(page.tokens(), weekdays)
                .orElseThrow(() -> new ScheduleNotFoundException(ExtractionFailure.LAYOUT_NOT_DETECTED));

        List<GridRow> rows = rowGrouper.group(page.tokens(), boundaries, weekdays);
        log.debug("Grouped {} token(s) into {} row(s)", page.tokens().size(), rows.size());

        ScheduleExtractor extractor = new ScheduleExtractor(effective, new RowClassifier(effective));
        ScheduleCaptures captures = extractor.extract(rows, targetName);
        return resolver.resolve(captures, findWeekEnding(page.fullText()).orElse(null), weekdays);
    }

    private Optional<String> findWeekEnding(String fullText) {
        Matcher matcher = settings.weekEndingPattern().matcher(fullText);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
