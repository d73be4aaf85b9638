package com.example.timesheet.application.parser;

/**
 * Role of a grid row while walking the timetable top to bottom.
 */
public enum RowKind {
    DATE_HEADER,
    SHIFT_TIME,
    CONTENT
}
