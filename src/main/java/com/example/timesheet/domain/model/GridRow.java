package com.example.timesheet.domain.model;

import java.util.List;

/**
 * One horizontal line of the reconstructed timetable grid.
 *
 * @param rowKey   rounded vertical position shared by every token of the row
 * @param cells    joined cell text per weekday column, empty when the column has no tokens
 * @param areaText text found left of the first column, empty when absent
 */
public record GridRow(
        long rowKey,
        List<String> cells,
        String areaText
) {

    public GridRow {
        cells = List.copyOf(cells);
        areaText = areaText == null ? "" : areaText;
    }

    public String cell(int column) {
        return cells.get(column);
    }

    public int columnCount() {
        return cells.size();
    }

    public boolean hasAreaText() {
        return !areaText.isBlank();
    }
}
