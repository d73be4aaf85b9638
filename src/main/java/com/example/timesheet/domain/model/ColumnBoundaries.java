package com.example.timesheet.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Horizontal partition of a page into weekday columns.
 * Holds {@code n + 1} strictly increasing coordinates defining {@code n} half-open intervals
 * {@code [b(i), b(i+1))}, leftmost column first.
 */
public final class ColumnBoundaries {

    /** Column index reported for coordinates left of the first boundary. */
    public static final int AREA_GUTTER = -1;
    /** Column index reported for coordinates at or right of the last boundary. */
    public static final int OUTSIDE = -2;

    private final double[] boundaries;

    private ColumnBoundaries(double[] boundaries) {
        this.boundaries = boundaries;
    }

    /**
     * Derives boundaries from sorted header centers. Inner boundaries sit halfway between
     * neighbouring centers; the outer ones mirror the nearest inner gap around the outermost centers.
     *
     * @param sortedCenters strictly increasing header centers, at least two
     * @return boundaries with one more entry than there are centers
     * @throws IllegalArgumentException when fewer than two centers are given or they are not strictly increasing
     */
    public static ColumnBoundaries fromHeaderCenters(double[] sortedCenters) {
        if (sortedCenters == null || sortedCenters.length < 2) {
            throw new IllegalArgumentException("At least two header centers are required.");
        }
        int columns = sortedCenters.length;
        for (int i = 1; i < columns; i++) {
            if (!(sortedCenters[i] > sortedCenters[i - 1])) {
                throw new IllegalArgumentException("Header centers must be strictly increasing.");
            }
        }
        double[] values = new double[columns + 1];
        for (int i = 1; i < columns; i++) {
            values[i] = (sortedCenters[i - 1] + sortedCenters[i]) / 2d;
        }
        values[0] = sortedCenters[0] - (values[1] - sortedCenters[0]);
        values[columns] = sortedCenters[columns - 1] + (sortedCenters[columns - 1] - values[columns - 1]);
        return new ColumnBoundaries(values);
    }

    /**
     * Resolves the column that owns the given horizontal coordinate.
     *
     * @param x horizontal coordinate, usually a token center
     * @return zero-based column index, {@link #AREA_GUTTER} or {@link #OUTSIDE}
     */
    public int locateColumn(double x) {
        if (x < boundaries[0]) {
            return AREA_GUTTER;
        }
        for (int i = 0; i < columnCount(); i++) {
            if (x >= boundaries[i] && x < boundaries[i + 1]) {
                return i;
            }
        }
        return OUTSIDE;
    }

    public int columnCount() {
        return boundaries.length - 1;
    }

    public List<Double> values() {
        List<Double> values = new ArrayList<>(boundaries.length);
        for (double boundary : boundaries) {
            values.add(boundary);
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public String toString() {
        return "ColumnBoundaries" + values();
    }
}
