package com.example.timesheet.domain.model;

/**
 * Domain DTO for a single word extracted from a PDF page together with its bounding box.
 * Coordinates share one page space: {@code x} grows to the right, {@code top} grows downwards.
 */
public record PositionedToken(
        String text,
        double x0,
        double x1,
        double top,
        double bottom
) {

    public PositionedToken {
        text = text == null ? "" : text;
    }

    /**
     * @return horizontal center used for column membership
     */
    public double center() {
        return (x0 + x1) / 2d;
    }

    /**
     * @return vertical clustering key; tokens sharing it belong to one grid row
     */
    public long rowKey() {
        return Math.round(top);
    }
}
