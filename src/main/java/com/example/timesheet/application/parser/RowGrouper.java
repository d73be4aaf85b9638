package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.ColumnBoundaries;
import com.example.timesheet.domain.model.GridRow;
import com.example.timesheet.domain.model.PositionedToken;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Clusters page tokens into grid rows by rounded vertical position and distributes each row's
 * tokens over the weekday columns and the area gutter.
 */
public class RowGrouper {

    /**
     * @param tokens         every token of the page
     * @param boundaries     column partition of the page
     * @param discardedTexts token texts left out of the grid, typically the weekday headers
     * @return rows ordered top to bottom
     */
    public List<GridRow> group(List<PositionedToken> tokens, ColumnBoundaries boundaries, Collection<String> discardedTexts) {
        Map<Long, List<PositionedToken>> buckets = new TreeMap<>();
        for (PositionedToken token : tokens) {
            if (token.text().isBlank() || discardedTexts.contains(token.text())) {
                continue;
            }
            buckets.computeIfAbsent(token.rowKey(), key -> new ArrayList<>()).add(token);
        }

        List<GridRow> rows = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, List<PositionedToken>> bucket : buckets.entrySet()) {
            rows.add(toRow(bucket.getKey(), bucket.getValue(), boundaries));
        }
        return rows;
    }

    private GridRow toRow(long rowKey, List<PositionedToken> tokens, ColumnBoundaries boundaries) {
        int columnCount = boundaries.columnCount();
        List<StringBuilder> cells = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            cells.add(new StringBuilder());
        }
        StringBuilder area = new StringBuilder();

        List<PositionedToken> ordered = new ArrayList<>(tokens);
        ordered.sort(Comparator.comparingDouble(PositionedToken::x0));
        for (PositionedToken token : ordered) {
            int column = boundaries.locateColumn(token.center());
            if (column == ColumnBoundaries.OUTSIDE) {
                continue;
            }
            append(column == ColumnBoundaries.AREA_GUTTER ? area : cells.get(column), token.text());
        }

        List<String> values = new ArrayList<>(columnCount);
        for (StringBuilder cell : cells) {
            values.add(cell.toString());
        }
        return new GridRow(rowKey, values, area.toString());
    }

    private static void append(StringBuilder builder, String text) {
        String value = text.strip();
        if (value.isEmpty()) {
            return;
        }
        if (builder.length() > 0) {
            builder.append(' ');
        }
        builder.append(value);
    }
}
