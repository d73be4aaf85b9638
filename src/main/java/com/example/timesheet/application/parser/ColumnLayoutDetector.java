package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.ColumnBoundaries;
import com.example.timesheet.domain.model.PositionedToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Locates the weekday header words on a page and derives the column boundaries from their centers.
 */
public class ColumnLayoutDetector {

    private static final Logger log = LoggerFactory.getLogger(ColumnLayoutDetector.class);

    /**
     * Builds the column partition from the first occurrence of every weekday header.
     * The left-to-right order of the headers is taken as the column order.
     *
     * @param tokens   every token of the page
     * @param weekdays weekday header texts, matched exactly and case-sensitively
     * @return boundaries, or empty when a header is missing or two headers share a center
     */
    public Optional<ColumnBoundaries> detect(List<PositionedToken> tokens, List<String> weekdays) {
        Map<String, PositionedToken> headers = new LinkedHashMap<>();
        for (PositionedToken token : tokens) {
            if (weekdays.contains(token.text()) && !headers.containsKey(token.text())) {
                headers.put(token.text(), token);
            }
        }
        if (headers.size() < weekdays.size()) {
            List<String> missing = weekdays.stream().filter(day -> !headers.containsKey(day)).toList();
            log.warn("Weekday headers not found on page: {}", missing);
            return Optional.empty();
        }

        double[] centers = headers.values().stream()
                .mapToDouble(PositionedToken::center)
                .sorted()
                .toArray();
        for (int i = 1; i < centers.length; i++) {
            if (centers[i] <= centers[i - 1]) {
                log.warn("Weekday headers overlap horizontally: {}", Arrays.toString(centers));
                return Optional.empty();
            }
        }

        ColumnBoundaries boundaries = ColumnBoundaries.fromHeaderCenters(centers);
        log.debug("Detected {}", boundaries);
        return Optional.of(boundaries);
    }
}
